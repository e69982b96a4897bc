package com.smartlists.ruleengine.runtime.evaluation;

import com.smartlists.ruleengine.api.model.MediaItem;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

/**
 * An item that matched at least one expression set.
 *
 * @param ordinal position of the item in the candidate stream, used for stable ordering
 * @param item    the item
 * @param groups  indices of every matching set, ascending
 */
public record MatchedItem(int ordinal, MediaItem item, IntList groups) {

    public MatchedItem {
        groups = IntLists.unmodifiable(groups);
    }

    public int firstGroup() {
        return groups.getInt(0);
    }

    public boolean inGroup(int group) {
        return groups.contains(group);
    }
}
