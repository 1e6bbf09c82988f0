// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ferrite.client.internal;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.Test;

class ResultRendererTest {

    @Test
    void rendersScalars() {
        assertEquals("", ResultRenderer.render(null));
        assertEquals("OK", ResultRenderer.render("OK"));
        assertEquals("42", ResultRenderer.render(42L));
        assertEquals("[a, b]", ResultRenderer.render(List.of("a", "b")));
    }

    @Test
    void rendersPrimitiveAndObjectArrays() {
        assertEquals("[1, 2, 3]", ResultRenderer.render(new int[] {1, 2, 3}));
        assertEquals("[true, false]", ResultRenderer.render(new boolean[] {true, false}));
        assertEquals("[a, , c]", ResultRenderer.render(new String[] {"a", null, "c"}));
        assertEquals("[]", ResultRenderer.render(new Object[0]));
    }

    @Test
    void rendersNestedArraysRecursively() {
        assertEquals("[[1, 2], [3]]", ResultRenderer.render(new long[][] {{1, 2}, {3}}));
        assertEquals("[k, [v1, v2]]", ResultRenderer.render(new Object[] {"k", new Object[] {"v1", "v2"}}));
    }

    @Test
    void rendersBytesAsElementList() {
        assertEquals("[104, 105]", ResultRenderer.render("hi".getBytes(StandardCharsets.UTF_8)));
        assertEquals("[[97], [98]]", ResultRenderer.render(new Object[] {
                "a".getBytes(StandardCharsets.UTF_8), "b".getBytes(StandardCharsets.UTF_8)}));
    }
}
