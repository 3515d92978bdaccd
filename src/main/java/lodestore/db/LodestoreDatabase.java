package lodestore.db;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * The in-memory keyspace: a flat string map and a map of hashes.
 * <p>
 * Values are kept as the raw bytes the client sent. Keys and hash fields are Latin-1 strings, one
 * char per byte, so any byte sequence maps to a key and back without loss
 * (see {@link lodestore.commands.CommandSupport#key(byte[])}).
 * <p>
 * Each map has its own read/write lock. No method holds both locks, and readers only ever see
 * copies, never the live inner hash maps. Stored arrays are never modified in place.
 */
public class LodestoreDatabase {

    private final Map<String, byte[]> strings = new HashMap<>();
    private final ReentrantReadWriteLock stringsLock = new ReentrantReadWriteLock();

    private final Map<String, Map<String, byte[]>> hashes = new HashMap<>();
    private final ReentrantReadWriteLock hashesLock = new ReentrantReadWriteLock();

    // --- STRINGS ---

    public void setString(String key, byte[] value) {
        stringsLock.writeLock().lock();
        try {
            strings.put(key, value);
        } finally {
            stringsLock.writeLock().unlock();
        }
    }

    /** @return the value, or null if the key was never written */
    public byte[] getString(String key) {
        stringsLock.readLock().lock();
        try {
            return strings.get(key);
        } finally {
            stringsLock.readLock().unlock();
        }
    }

    public int stringCount() {
        stringsLock.readLock().lock();
        try {
            return strings.size();
        } finally {
            stringsLock.readLock().unlock();
        }
    }

    // --- HASHES ---

    /**
     * Sets a field, creating the hash on first write.
     *
     * @return true if the field did not exist before
     */
    public boolean setHashField(String key, String field, byte[] value) {
        hashesLock.writeLock().lock();
        try {
            Map<String, byte[]> hash = hashes.computeIfAbsent(key, k -> new HashMap<>());
            return hash.put(field, value) == null;
        } finally {
            hashesLock.writeLock().unlock();
        }
    }

    /** @return the field value, or null if the hash or the field is missing */
    public byte[] getHashField(String key, String field) {
        hashesLock.readLock().lock();
        try {
            Map<String, byte[]> hash = hashes.get(key);
            return hash == null ? null : hash.get(field);
        } finally {
            hashesLock.readLock().unlock();
        }
    }

    /** @return a snapshot of the hash, or null if no field was ever written to it */
    public Map<String, byte[]> getAllHashFields(String key) {
        hashesLock.readLock().lock();
        try {
            Map<String, byte[]> hash = hashes.get(key);
            return hash == null ? null : Collections.unmodifiableMap(new HashMap<>(hash));
        } finally {
            hashesLock.readLock().unlock();
        }
    }

    public int hashCount() {
        hashesLock.readLock().lock();
        try {
            return hashes.size();
        } finally {
            hashesLock.readLock().unlock();
        }
    }

    // --- MAINTENANCE ---

    public void clear() {
        stringsLock.writeLock().lock();
        try {
            strings.clear();
        } finally {
            stringsLock.writeLock().unlock();
        }
        hashesLock.writeLock().lock();
        try {
            hashes.clear();
        } finally {
            hashesLock.writeLock().unlock();
        }
    }
}
