package redislite.db;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MemoryStoreTest {

    @Test
    public void testBasicOperations() throws Exception {
        MemoryStore store = new MemoryStore();
        assertEquals(0, store.size());
        assertNull(store.get("k"));
        assertFalse(store.exists("k"));

        store.set("k", "v");
        assertEquals("v", store.get("k"));
        assertTrue(store.exists("k"));
        assertEquals(1, store.size());

        store.set("k", "w");
        assertEquals("w", store.get("k"));
        assertEquals(1, store.size());

        assertTrue(store.delete("k"));
        assertFalse(store.delete("k"));
        assertNull(store.get("k"));
        assertEquals(0, store.size());
    }

    @Test
    public void testEmptyValueIsPresent() throws Exception {
        MemoryStore store = new MemoryStore();
        store.set("", "");
        assertTrue(store.exists(""));
        assertEquals("", store.get(""));
    }

    @Test
    public void testClear() throws Exception {
        MemoryStore store = new MemoryStore();
        for (int i = 0; i < 100; i++) store.set("key" + i, "v" + i);
        assertEquals(100, store.size());
        store.clear();
        assertEquals(0, store.size());
        assertFalse(store.exists("key5"));
    }

    @Test
    public void testRejectsNulls() {
        MemoryStore store = new MemoryStore();
        StoreException e = assertThrows(StoreException.class, () -> store.set(null, "v"));
        assertEquals("key cannot be null", e.getMessage());
        e = assertThrows(StoreException.class, () -> store.set("k", null));
        assertEquals("value cannot be null", e.getMessage());
        assertEquals(0, store.size());
    }
}
