package redislite.db;

/**
 * String key/value capability consumed by commands. Every call is atomic with
 * respect to every other call on the same store.
 *
 * <p>Keys and values are byte strings: each char holds one byte (0-255) of the
 * client's payload, so distinct binary keys never collide.
 */
public interface Store {

    void set(String key, String value) throws StoreException;

    /**
     * @return the value, or null when the key is absent
     */
    String get(String key);

    /**
     * @return true if the key existed
     */
    boolean delete(String key);

    boolean exists(String key);

    int size();

    void clear();
}
