package com.gt.lss.model;

import java.util.List;

public record EnrichedItem(CandidateItem item, List<String> parentIds) {

    public String id() {
        return item.id();
    }
}
