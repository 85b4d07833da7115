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

import org.junit.Test;
import static org.junit.Assert.*;

public class ServiceLibTest {

    private static final class LinkageErrorImpl {
        public LinkageErrorImpl() {
            throw(new LinkageError("Simulated linkage error"));
        }
    }

    /*
     * LinkageErrors raised while loading a candidate must not escape.
     */
    @Test
    public void linkageErrorIsCaught() throws Exception {
        try {
            System.setProperty(LinkageErrorImpl.class.getName(),
                    LinkageErrorImpl.class.getName());
            ServiceLib.loadService(LinkageErrorImpl.class);
            fail("Should not make it here");
        } catch (IllegalStateException isx) {
            // Couldn't find a service impl.  This is good.
        } catch (Throwable thr) {
            fail("LinkageError exposed a throwable");
        } finally {
            System.getProperties().remove(LinkageErrorImpl.class.getName());
        }
    }

    @Test
    public void apacheSenderIsDefault() {
        HTTPSender sender = ServiceLib.loadService(HTTPSender.class);
        assertTrue(sender.getClass().getName(),
                sender instanceof ApacheHTTPSender);
    }

    @Test
    public void systemPropertySelectsSender() {
        try {
            System.setProperty(HTTPSender.class.getName(),
                    XLightWebSender.class.getName());
            HTTPSender sender = ServiceLib.loadService(HTTPSender.class);
            assertTrue(sender.getClass().getName(),
                    sender instanceof XLightWebSender);
        } finally {
            System.getProperties().remove(HTTPSender.class.getName());
        }
    }

    @Test
    public void unknownOverrideFallsBack() {
        try {
            System.setProperty(HTTPSender.class.getName(),
                    "org.example.NoSuchSender");
            HTTPSender sender = ServiceLib.loadService(HTTPSender.class);
            assertTrue(sender instanceof ApacheHTTPSender);
        } finally {
            System.getProperties().remove(HTTPSender.class.getName());
        }
    }

}
