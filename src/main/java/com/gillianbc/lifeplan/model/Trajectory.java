package com.gillianbc.lifeplan.model;

import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Full year-by-year projection of one profile.
 */
@Value
public class Trajectory {

    @NonNull String profileId;
    @NonNull Instant generatedAt;
    @NonNull List<TrajectoryYear> years;
    @NonNull List<Milestone> milestones;
    @NonNull TrajectorySummary summary;

    public Trajectory(String profileId, Instant generatedAt, List<TrajectoryYear> years,
                      List<Milestone> milestones, TrajectorySummary summary) {
        this.profileId = Objects.requireNonNull(profileId, "profileId must not be null");
        this.generatedAt = Objects.requireNonNull(generatedAt, "generatedAt must not be null");
        this.years = List.copyOf(years);
        this.milestones = List.copyOf(milestones);
        this.summary = Objects.requireNonNull(summary, "summary must not be null");
    }

    public Optional<TrajectoryYear> findYear(int year) {
        return years.stream().filter(y -> y.getYear() == year).findFirst();
    }
}
