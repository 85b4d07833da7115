/*
 * Copyright 2009 Mike Cumings
 * Copyright 2026 The BOSH Transport Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.igniterealtime.boshtransport;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Utility library for use in loading services using the Jar Service
 * Provider Interface (Jar SPI).  Unlike {@code java.util.ServiceLoader},
 * candidates which fail to load are skipped and the first usable one wins.
 */
final class ServiceLib {

    /**
     * Logger.
     */
    private static final Logger LOG =
            Logger.getLogger(ServiceLib.class.getName());

    ///////////////////////////////////////////////////////////////////////////
    // Constructors:

    /**
     * Prevent construction.
     */
    private ServiceLib() {
        // Empty
    }

    ///////////////////////////////////////////////////////////////////////////
    // Package-private methods:

    /**
     * Probe for and select an implementation of the specified service
     * type by using a modified Jar SPI mechanism.  Modified in that
     * the system properties will be checked to see if there is a value
     * set for the name of the class to be loaded.  If so, that value is
     * treated as the class name of the first implementation class to be
     * attempted to be loaded.  This provides a (unsupported) mechanism
     * to insert other implementations.  Note that the supported mechanism
     * is by properly ordering the classpath.
     *
     * @param <T> service type
     * @param ofType service type to load
     * @return service instance
     * @throws IllegalStateException if no service implementations could be
     *  instantiated
     */
    static <T> T loadService(final Class<T> ofType) {
        List<String> implClasses = loadServicesImplementations(ofType);
        for (String implClass : implClasses) {
            T result = attemptLoad(ofType, implClass);
            if (result != null) {
                if (LOG.isLoggable(Level.FINEST)) {
                    LOG.finest("Selected " + ofType.getSimpleName()
                            + " implementation: "
                            + result.getClass().getName());
                }
                return result;
            }
        }
        throw(new IllegalStateException(
                "Could not load " + ofType.getName() + " implementation"));
    }

    ///////////////////////////////////////////////////////////////////////////
    // Private methods:

    /**
     * Generates a list of implementation class names for the specified
     * service type.
     *
     * @param ofClass service type
     * @return list of one or more implementation class names
     */
    private static List<String> loadServicesImplementations(
            final Class<?> ofClass) {
        List<String> result = new ArrayList<String>();

        // Allow a sysprop to specify the first candidate
        String override = System.getProperty(ofClass.getName());
        if (override != null) {
            result.add(override);
        }

        ClassLoader loader = ServiceLib.class.getClassLoader();
        try {
            Enumeration<URL> urls =
                    loader.getResources("META-INF/services/"
                    + ofClass.getName());
            while (urls.hasMoreElements()) {
                readServiceFile(urls.nextElement(), result);
            }
        } catch (IOException iox) {
            LOG.log(Level.WARNING,
                    "Could not load services descriptor(s)", iox);
        }
        return result;
    }

    /**
     * Reads the service file at the given URL, adding every implementation
     * class name it lists to the result.
     *
     * @param url service file location
     * @param result list to add class names to
     */
    private static void readServiceFile(
            final URL url, final List<String> result) {
        InputStream inStream = null;
        try {
            inStream = url.openStream();
            BufferedReader reader = new BufferedReader(new InputStreamReader(
                    inStream, StandardCharsets.UTF_8));
            String line;
            while ((line = reader.readLine()) != null) {
                int comment = line.indexOf('#');
                if (comment >= 0) {
                    line = line.substring(0, comment);
                }
                line = line.trim();
                if (line.length() > 0 && !result.contains(line)) {
                    result.add(line);
                }
            }
        } catch (IOException iox) {
            LOG.log(Level.WARNING,
                    "Could not read services descriptor: " + url, iox);
        } finally {
            finalClose(inStream);
        }
    }

    /**
     * Attempts to load the specified implementation class.
     * Attempts will fail if - for example - the implementation depends
     * on a class not found on the classpath.
     *
     * @param <T> service type
     * @param ofClass service type
     * @param className implementation class to attempt to load
     * @return service instance, or {@code null} if the instance could not be
     *  loaded
     */
    private static <T> T attemptLoad(
            final Class<T> ofClass,
            final String className) {
        if (LOG.isLoggable(Level.FINEST)) {
            LOG.finest("Attempting service load: " + className);
        }
        Level level;
        Throwable thrown;
        try {
            Class<?> clazz = Class.forName(className);
            if (!ofClass.isAssignableFrom(clazz)) {
                if (LOG.isLoggable(Level.WARNING)) {
                    LOG.warning(clazz.getName() + " is not assignable to "
                            + ofClass.getName());
                }
                return null;
            }
            Constructor<?> ctor =
                    clazz.getDeclaredConstructor();
            ctor.setAccessible(true);
            return ofClass.cast(ctor.newInstance());
        } catch (LinkageError lex) {
            level = Level.WARNING;
            thrown = lex;
        } catch (ClassNotFoundException cnfx) {
            level = Level.FINEST;
            thrown = cnfx;
        } catch (InvocationTargetException itx) {
            level = Level.WARNING;
            thrown = itx.getCause();
        } catch (ReflectiveOperationException rox) {
            level = Level.WARNING;
            thrown = rox;
        }
        LOG.log(level,
                "Could not load " + ofClass.getSimpleName()
                + " instance: " + className,
                thrown);
        return null;
    }

    /**
     * Check and close a closeable object, trapping and ignoring any
     * exception that might result.
     *
     * @param closeMe the thing to close
     */
    private static void finalClose(final InputStream closeMe) {
        if (closeMe != null) {
            try {
                closeMe.close();
            } catch (IOException iox) {
                LOG.log(Level.FINEST, "Could not close: " + closeMe, iox);
            }
        }
    }

}
