package com.gt.lss.model;

public record ScoredItem(CandidateItem item, double readiness, long daysOverdue, double finalScore) {

    public String id() {
        return item.id();
    }
}
