package com.gillianbc.lifeplan.service;

import com.gillianbc.lifeplan.config.ProjectionProperties;
import com.gillianbc.lifeplan.model.AssetState;
import com.gillianbc.lifeplan.model.AssetType;
import com.gillianbc.lifeplan.model.Debt;
import com.gillianbc.lifeplan.model.DebtState;
import com.gillianbc.lifeplan.model.Goal;
import com.gillianbc.lifeplan.model.Milestone;
import com.gillianbc.lifeplan.model.MilestoneType;
import com.gillianbc.lifeplan.model.TrajectoryYear;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compares one projected year with the year before it and reports the events in between.
 * Holds no per-run state: everything that must not fire twice is passed in by the caller.
 */
@Component
public class MilestoneDetector {

    private static final int YEAR_END = 12;

    private final List<BigDecimal> netWorthThresholds;

    @Autowired
    public MilestoneDetector(ProjectionProperties properties) {
        this(properties.getNetWorthThresholds());
    }

    /**
     * @param netWorthThresholds strictly increasing, positive amounts
     */
    public MilestoneDetector(List<BigDecimal> netWorthThresholds) {
        Objects.requireNonNull(netWorthThresholds, "netWorthThresholds must not be null");
        BigDecimal previous = null;
        for (int i = 0; i < netWorthThresholds.size(); i++) {
            BigDecimal threshold = Objects.requireNonNull(netWorthThresholds.get(i), "netWorthThresholds contains null");
            if (threshold.signum() <= 0) {
                throw new IllegalArgumentException("netWorthThresholds[" + i + "] must be > 0");
            }
            if (previous != null && threshold.compareTo(previous) <= 0) {
                throw new IllegalArgumentException("netWorthThresholds must be strictly increasing without duplicates (at index " + i + ")");
            }
            previous = threshold;
        }
        this.netWorthThresholds = List.copyOf(netWorthThresholds);
    }

    public List<BigDecimal> getNetWorthThresholds() {
        return netWorthThresholds;
    }

    /**
     * Thresholds already exceeded by a net worth; used to seed the starting position so that
     * only later crossings are reported.
     */
    public List<BigDecimal> exceededThresholds(BigDecimal netWorth) {
        List<BigDecimal> exceeded = new ArrayList<>();
        if (netWorth.signum() <= 0) {
            return exceeded;
        }
        for (BigDecimal threshold : netWorthThresholds) {
            if (netWorth.compareTo(threshold) > 0) {
                exceeded.add(threshold);
            }
        }
        return exceeded;
    }

    /**
     * Thresholds newly exceeded this year. A threshold fires only while net worth is positive and
     * strictly above it, and only if it is not already in {@code reached}.
     */
    public List<BigDecimal> newlyExceededThresholds(BigDecimal netWorth, Collection<BigDecimal> reached) {
        List<BigDecimal> crossed = new ArrayList<>();
        for (BigDecimal threshold : exceededThresholds(netWorth)) {
            if (reached.stream().noneMatch(r -> r.compareTo(threshold) == 0)) {
                crossed.add(threshold);
            }
        }
        return crossed;
    }

    public Milestone netWorthMilestone(BigDecimal threshold, int year) {
        return new Milestone(MilestoneType.NET_WORTH_MILESTONE, year, YEAR_END,
                "Net worth passed " + Money.format(threshold), null);
    }

    /**
     * Debts that moved from owing to cleared, reported in their payoff month.
     */
    public List<Milestone> debtPayoffs(List<Debt> debts, List<DebtState> previous, TrajectoryYear year) {
        List<Milestone> milestones = new ArrayList<>();
        for (int i = 0; i < debts.size(); i++) {
            DebtState before = previous.get(i);
            DebtState after = year.getDebts().get(i);
            if (!before.isPaidOff() && after.isPaidOff()) {
                int month = after.getPayoffMonth() != null ? after.getPayoffMonth() : YEAR_END;
                milestones.add(new Milestone(MilestoneType.DEBT_PAYOFF, year.getYear(), month,
                        "Paid off " + debts.get(i).getName(), debts.get(i).getId()));
            }
        }
        return milestones;
    }

    public List<Milestone> pmiRemovals(List<Debt> debts, List<DebtState> previous, TrajectoryYear year) {
        List<Milestone> milestones = new ArrayList<>();
        for (int i = 0; i < debts.size(); i++) {
            if (previous.get(i).isPayingPmi() && !year.getDebts().get(i).isPayingPmi()) {
                milestones.add(new Milestone(MilestoneType.PMI_REMOVED, year.getYear(), YEAR_END,
                        "PMI removed on " + debts.get(i).getName(), debts.get(i).getId()));
            }
        }
        return milestones;
    }

    public Milestone retirementReady(TrajectoryYear year) {
        return new Milestone(MilestoneType.RETIREMENT_READY, year.getYear(), YEAR_END,
                "Retirement ready at age " + year.getAge(), null);
    }

    /**
     * Goals resolved this year: achieved the first year their metric is met, missed once the
     * target year passes without it. Goals in {@code resolvedGoalIds} are skipped.
     */
    public List<Milestone> goals(List<Goal> goals, Collection<String> resolvedGoalIds, TrajectoryYear year,
                                 Map<String, AssetType> assetTypes) {
        List<Milestone> milestones = new ArrayList<>();
        for (Goal goal : goals) {
            if (resolvedGoalIds.contains(goal.getId())) {
                continue;
            }
            if (isMet(goal, year, assetTypes)) {
                milestones.add(new Milestone(MilestoneType.GOAL_ACHIEVED, year.getYear(), YEAR_END,
                        "Goal achieved: " + goal.getName(), goal.getId()));
            } else if (year.getYear() >= goal.getTargetDate().getYear()) {
                milestones.add(new Milestone(MilestoneType.GOAL_MISSED, year.getYear(), goal.getTargetDate().getMonth(),
                        "Goal missed: " + goal.getName(), goal.getId()));
            }
        }
        return milestones;
    }

    private static boolean isMet(Goal goal, TrajectoryYear year, Map<String, AssetType> assetTypes) {
        return switch (goal.getType()) {
            case NET_WORTH -> year.getNetWorth().compareTo(goal.getTargetAmount()) >= 0;
            case SAVINGS -> sumAssets(year, assetTypes, true).compareTo(goal.getTargetAmount()) >= 0;
            case DEBT_FREE -> year.getTotalDebt().signum() == 0;
            case RETIREMENT -> sumAssets(year, assetTypes, false).compareTo(goal.getTargetAmount()) >= 0;
        };
    }

    private static BigDecimal sumAssets(TrajectoryYear year, Map<String, AssetType> assetTypes, boolean liquid) {
        BigDecimal total = BigDecimal.ZERO;
        for (AssetState state : year.getAssets()) {
            AssetType type = assetTypes.get(state.getAssetId());
            if (type != null && (liquid ? type.isLiquid() : type.isRetirementEligible())) {
                total = total.add(state.getBalance());
            }
        }
        return total;
    }
}
