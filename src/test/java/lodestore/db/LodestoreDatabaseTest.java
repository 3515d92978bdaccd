package lodestore.db;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class LodestoreDatabaseTest {

    private LodestoreDatabase db;

    @BeforeEach
    public void setup() {
        db = new LodestoreDatabase();
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    public void testStringUpsert() {
        assertNull(db.getString("k"));
        db.setString("k", bytes("v1"));
        db.setString("k", bytes("v2"));
        assertArrayEquals(bytes("v2"), db.getString("k"));
        assertEquals(1, db.stringCount());
    }

    @Test
    public void testEmptyValueIsNotAbsent() {
        db.setString("k", new byte[0]);
        assertArrayEquals(new byte[0], db.getString("k"));
        assertNull(db.getString("other"));
    }

    @Test
    public void testValuesAreKeptByteForByte() {
        byte[] raw = {(byte) 0xFF, (byte) 0xFE, 0, (byte) 0x80};
        db.setString("k", raw);
        db.setHashField("h", "f", raw);
        assertArrayEquals(raw, db.getString("k"));
        assertArrayEquals(raw, db.getHashField("h", "f"));
    }

    @Test
    public void testHashCreatedLazily() {
        assertNull(db.getAllHashFields("h"));
        assertNull(db.getHashField("h", "f"));

        assertTrue(db.setHashField("h", "f", bytes("v")));
        assertFalse(db.setHashField("h", "f", bytes("v2")));

        assertArrayEquals(bytes("v2"), db.getHashField("h", "f"));
        assertNull(db.getHashField("h", "missing"));
        assertEquals(1, db.hashCount());
    }

    @Test
    public void testGetAllReturnsSnapshot() {
        db.setHashField("h", "a", bytes("1"));
        Map<String, byte[]> snapshot = db.getAllHashFields("h");

        db.setHashField("h", "b", bytes("2"));
        assertEquals(1, snapshot.size());
        assertEquals(2, db.getAllHashFields("h").size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.put("c", bytes("3")));
    }

    @Test
    public void testStringAndHashKeyspacesAreIndependent() {
        db.setString("same", bytes("flat"));
        db.setHashField("same", "f", bytes("nested"));

        assertArrayEquals(bytes("flat"), db.getString("same"));
        assertArrayEquals(bytes("nested"), db.getHashField("same", "f"));
    }

    @Test
    public void testClear() {
        db.setString("k", bytes("v"));
        db.setHashField("h", "f", bytes("v"));
        db.clear();
        assertEquals(0, db.stringCount());
        assertEquals(0, db.hashCount());
    }
}
