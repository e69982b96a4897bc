package com.smartlists.ruleengine.api.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One entry of an evaluated list.
 *
 * @param item       the source item, unmodified
 * @param sortKey    resolved value of every configured sort key, nulls for missing values
 * @param groupIndex expression set the item is attributed to
 */
public record ResultItem(MediaItem item, List<Object> sortKey, int groupIndex) {

    public ResultItem {
        sortKey = sortKey != null ? Collections.unmodifiableList(new ArrayList<>(sortKey)) : List.of();
    }

    public String itemId() {
        return item.id();
    }

    public double runtimeMinutes() {
        return item.runtimeMinutes();
    }
}
