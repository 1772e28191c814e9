package com.repstack.service.component;

import java.util.Collection;
import java.util.List;

/**
 * Per-user memory of knowledge chunk ids already shown, so retrieval can prefer unseen knowledge.
 * Entries expire after the novelty window.
 */
public interface KnowledgeNoveltyStore {

    /**
     * ids returned to the user inside the window, oldest first; empty on any store problem
     */
    List<Long> recentIds(Long userId);

    /**
     * Merges ids into the user's list, keeping only the most recent entries, and refreshes the expiry.
     */
    void remember(Long userId, Collection<Long> ids);
}
