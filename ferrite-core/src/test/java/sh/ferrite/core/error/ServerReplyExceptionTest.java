// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ferrite.core.error;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ServerReplyExceptionTest {

    @Test
    void detectsWrongType() {
        ServerReplyException ex = new ServerReplyException(
                "WRONGTYPE Operation against a key holding the wrong kind of value");
        assertEquals("WRONGTYPE", ex.prefix());
        assertTrue(ex.isWrongType());
        assertFalse(ex.isNoScript());
    }

    @Test
    void detectsNoScript() {
        ServerReplyException ex = new ServerReplyException("NOSCRIPT No matching script.");
        assertTrue(ex.isNoScript());
    }

    @Test
    void blankMessageHasNoPrefix() {
        assertEquals("", new ServerReplyException(" ").prefix());
        assertEquals("ERR", new ServerReplyException("ERR").prefix());
    }

    @Test
    void isAFerriteException() {
        FerriteException ex = new ServerReplyException("ERR unknown command");
        assertTrue(ex instanceof ServerReplyException);
    }
}
