package ou.capstone.fantasy.store;

import ou.capstone.fantasy.exceptions.StoreException;

/**
 * Persistent home of the league documents. Reads and writes whole documents only.
 */
public interface LeagueStore {

    /**
     * Loads every document.
     *
     * @throws StoreException if a required document is missing or cannot be read
     */
    LeagueData load() throws StoreException;

    /**
     * Replaces every document with the given state.
     *
     * @throws StoreException if a document cannot be written
     */
    void save(LeagueData data) throws StoreException;
}
