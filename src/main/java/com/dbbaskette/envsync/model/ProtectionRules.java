package com.dbbaskette.envsync.model;

import jakarta.persistence.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Deployment protection policy applied to a GitHub environment.
 */
@Embeddable
public class ProtectionRules {

    @Column(name = "required_reviewers", nullable = false)
    private int requiredReviewers;

    @Convert(converter = JsonColumnConverters.LongListConverter.class)
    @Column(name = "reviewer_ids", length = 1000)
    private List<Long> reviewerIds = new ArrayList<>();

    @Column(name = "restrict_to_main_branch", nullable = false)
    private boolean restrictToMainBranch;

    @Column(name = "wait_timer_minutes", nullable = false)
    private int waitTimerMinutes;

    public ProtectionRules() {}

    public ProtectionRules(int requiredReviewers, List<Long> reviewerIds,
                           boolean restrictToMainBranch, int waitTimerMinutes) {
        this.requiredReviewers = requiredReviewers;
        this.reviewerIds = reviewerIds == null ? new ArrayList<>() : new ArrayList<>(reviewerIds);
        this.restrictToMainBranch = restrictToMainBranch;
        this.waitTimerMinutes = waitTimerMinutes;
    }

    public static ProtectionRules none() {
        return new ProtectionRules(0, List.of(), false, 0);
    }

    public ProtectionRules copy() {
        return new ProtectionRules(requiredReviewers, reviewerIds, restrictToMainBranch, waitTimerMinutes);
    }

    public int getRequiredReviewers() { return requiredReviewers; }
    public void setRequiredReviewers(int requiredReviewers) { this.requiredReviewers = requiredReviewers; }

    public List<Long> getReviewerIds() { return reviewerIds; }
    public void setReviewerIds(List<Long> reviewerIds) {
        this.reviewerIds = reviewerIds == null ? new ArrayList<>() : new ArrayList<>(reviewerIds);
    }

    public boolean isRestrictToMainBranch() { return restrictToMainBranch; }
    public void setRestrictToMainBranch(boolean restrictToMainBranch) { this.restrictToMainBranch = restrictToMainBranch; }

    public int getWaitTimerMinutes() { return waitTimerMinutes; }
    public void setWaitTimerMinutes(int waitTimerMinutes) { this.waitTimerMinutes = waitTimerMinutes; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProtectionRules other)) return false;
        return requiredReviewers == other.requiredReviewers
                && restrictToMainBranch == other.restrictToMainBranch
                && waitTimerMinutes == other.waitTimerMinutes
                && Objects.equals(reviewerIds, other.reviewerIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(requiredReviewers, reviewerIds, restrictToMainBranch, waitTimerMinutes);
    }
}
