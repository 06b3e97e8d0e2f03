package org.dxworks.hybridnote.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BlockMetadataTest {

    @Test
    void testPropertiesKeepInsertionOrder() {
        BlockMetadata metadata = BlockMetadata.builder()
                .property("zeta", "1")
                .property("alpha", "2")
                .property("mid", "3")
                .build();

        assertEquals(List.of("zeta", "alpha", "mid"), List.copyOf(metadata.getProperties().keySet()));
    }

    @Test
    void testWithersLeaveOriginalUntouched() {
        BlockMetadata original = BlockMetadata.empty();

        BlockMetadata changed = original.withId("x").withTodoState("DONE").withProperty("k", "v");

        assertTrue(original.isEmpty());
        assertEquals("x", changed.getId());
        assertEquals("DONE", changed.getTodoState());
        assertEquals("v", changed.getProperty("k"));
        assertEquals(changed, changed.toBuilder().build());
    }

    @Test
    void testHeadingLevelMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> BlockMetadata.builder().headingLevel(0).build());
        assertThrows(UnsupportedOperationException.class,
                () -> BlockMetadata.builder().property("a", "b").build().getProperties().put("c", "d"));
    }
}
