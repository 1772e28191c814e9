package com.repstack.service.impl;

import com.repstack.common.LevelConstants;
import com.repstack.mapper.UserProfileMapper;
import com.repstack.mapper.WorkoutSessionMapper;
import com.repstack.model.dto.LevelTestSubmissionDTO;
import com.repstack.model.entity.UserProfile;
import com.repstack.model.entity.WorkoutSet;
import com.repstack.model.enums.IneligibilityReason;
import com.repstack.model.enums.Lift;
import com.repstack.model.enums.Tier;
import com.repstack.model.vo.EligibilityVO;
import com.repstack.model.vo.LevelTestResultVO;
import com.repstack.model.vo.PromotionReadinessVO;
import com.repstack.model.vo.PromotionTestVO;
import com.repstack.service.LevelTestService;
import com.repstack.util.IdGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Promotion test state machine: eligibility -> test -> evaluation (-> promotion).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LevelTestServiceImpl implements LevelTestService {

    private static final int REQUIRED_REPS = 1;
    private static final int READINESS_WEEKS = 8;
    private static final BigDecimal HEIGHT_BASE_OFFSET = BigDecimal.valueOf(100);
    static final String PROFILE_LOOKUP_FAILED = "Profile could not be loaded right now, try again later";

    private final UserProfileMapper userProfileMapper;
    private final WorkoutSessionMapper workoutSessionMapper;

    // ================= eligibility =================

    @Override
    public EligibilityVO checkEligibility(Long userId) {
        try {
            UserProfile profile = userProfileMapper.selectByUserId(userId);
            if (profile == null) {
                return ineligible(IneligibilityReason.PROFILE_NOT_FOUND, "No profile found for this user", null)
                        .build();
            }
            int level = LevelConstants.clampLevel(profile.getLevel());

            // (a) level cap
            if (level >= LevelConstants.MAX_LEVEL) {
                return ineligible(IneligibilityReason.MAX_LEVEL_REACHED, "Already at the highest level", level)
                        .build();
            }

            // (b) workouts since the last test, only once a test has been taken
            int required = LevelConstants.requiredWorkouts(level);
            LocalDateTime lastTest = profile.getLastLevelTestAt();
            int completed = workoutSessionMapper.countCompletedSince(userId, lastTest);
            if (lastTest != null && completed < required) {
                return ineligible(IneligibilityReason.INSUFFICIENT_WORKOUTS,
                        String.format("Complete %d more workout(s) before the next test", required - completed), level)
                        .completedWorkouts(completed)
                        .requiredWorkouts(required)
                        .build();
            }

            // (c) cooldown
            if (lastTest != null) {
                long daysSince = ChronoUnit.DAYS.between(lastTest, LocalDateTime.now());
                if (daysSince < LevelConstants.LEVEL_TEST_COOLDOWN_DAYS) {
                    long remaining = LevelConstants.LEVEL_TEST_COOLDOWN_DAYS - daysSince;
                    return ineligible(IneligibilityReason.COOLDOWN_ACTIVE,
                            String.format("Next test available in %d day(s)", remaining), level)
                            .completedWorkouts(completed)
                            .requiredWorkouts(required)
                            .daysUntilEligible(remaining)
                            .build();
                }
            }

            return EligibilityVO.builder()
                    .eligible(true)
                    .message("Eligible for the level " + (level + 1) + " test")
                    .currentLevel(level)
                    .targetLevel(level + 1)
                    .completedWorkouts(completed)
                    .requiredWorkouts(required)
                    .daysUntilEligible(0L)
                    .build();
        } catch (Exception e) {
            log.error("Eligibility check failed, userId={}", userId, e);
            return ineligible(IneligibilityReason.LOOKUP_FAILED, "Eligibility could not be determined right now", null)
                    .build();
        }
    }

    // ================= test generation =================

    @Override
    public PromotionTestVO generateTest(Long userId) {
        EligibilityVO eligibility = checkEligibility(userId);
        if (!eligibility.isEligible()) {
            throw new IllegalStateException(eligibility.getMessage());
        }
        UserProfile profile = requireProfile(userId);
        int level = LevelConstants.clampLevel(profile.getLevel());
        int target = targetLevel(level);
        Tier targetTier = LevelConstants.tierFor(target);

        List<PromotionTestVO.LiftRequirement> lifts = new ArrayList<>();
        for (Lift lift : Lift.values()) {
            lifts.add(new PromotionTestVO.LiftRequirement(lift, lift.getDisplayName(),
                    requiredLoad(profile.getHeightCm(), target, lift), REQUIRED_REPS));
        }

        PromotionTestVO test = PromotionTestVO.builder()
                .testId(IdGenerator.next("LT-" + target))
                .currentLevel(level)
                .targetLevel(target)
                .targetTier(targetTier.getLabel())
                .testType(LevelConstants.levelTestType(target))
                .exercises(lifts)
                .timeLimitMinutes(LevelConstants.LEVEL_TEST_TIME_LIMIT_MINUTES)
                .instructions(List.of(
                        "Warm up for 10 minutes before the first attempt.",
                        "Perform each lift for at least 1 rep with full range of motion at the required load.",
                        "Rest 3-5 minutes between attempts; use a spotter for bench press and squat.",
                        "Finish all three lifts within " + LevelConstants.LEVEL_TEST_TIME_LIMIT_MINUTES + " minutes."))
                .build();
        log.info("Level test generated, userId={}, testId={}, target={}", userId, test.getTestId(), target);
        return test;
    }

    // ================= evaluation =================

    @Override
    public LevelTestResultVO evaluate(Long userId, LevelTestSubmissionDTO submission) {
        UserProfile profile = requireProfile(userId);
        int level = LevelConstants.clampLevel(profile.getLevel());
        if (level >= LevelConstants.MAX_LEVEL) {
            throw new IllegalStateException("Already at the highest level");
        }
        int target = targetLevel(level);

        // 1. best weight per lift, unknown lift types ignored
        Map<Lift, BigDecimal> best = bestAttempts(submission);

        // 2. compare with the requirement
        List<LevelTestResultVO.LiftResult> results = new ArrayList<>();
        boolean allPassed = true;
        for (Lift lift : Lift.values()) {
            BigDecimal required = requiredLoad(profile.getHeightCm(), target, lift);
            BigDecimal achieved = best.get(lift);
            boolean passed = achieved != null && achieved.compareTo(required) >= 0;
            BigDecimal gap = passed ? BigDecimal.ZERO.setScale(1)
                    : required.subtract(achieved != null ? achieved : BigDecimal.ZERO).setScale(1, RoundingMode.HALF_UP);
            results.add(new LevelTestResultVO.LiftResult(lift, required, achieved, passed, gap));
            allPassed &= passed;
        }

        // 3. state change
        LocalDateTime now = LocalDateTime.now();
        Tier newTier = LevelConstants.tierFor(allPassed ? target : level);
        try {
            if (allPassed) {
                userProfileMapper.updateLevel(userId, target, newTier.getLabel(), now);
            } else {
                userProfileMapper.updateLastLevelTestAt(userId, now);
            }
        } catch (Exception e) {
            log.warn("Failed to store level test outcome, userId={}, passed={}: {}", userId, allPassed, e.getMessage());
        }
        log.info("Level test evaluated, userId={}, target={}, passed={}", userId, target, allPassed);

        return LevelTestResultVO.builder()
                .testId(submission != null ? submission.getTestId() : null)
                .passed(allPassed)
                .previousLevel(level)
                .newLevel(allPassed ? target : level)
                .newTier(newTier.getLabel())
                .results(results)
                .feedback(feedback(allPassed, target, newTier, results))
                .nextSteps(nextSteps(allPassed, results))
                .build();
    }

    // ================= readiness =================

    @Override
    public PromotionReadinessVO checkPromotionReadiness(Long userId) {
        UserProfile profile = requireProfile(userId);
        int level = LevelConstants.clampLevel(profile.getLevel());
        if (level >= LevelConstants.MAX_LEVEL) {
            return PromotionReadinessVO.builder()
                    .currentLevel(level)
                    .targetLevel(level)
                    .ready(false)
                    .overallRatio(BigDecimal.ZERO)
                    .lifts(Collections.emptyList())
                    .message("Already at the highest level")
                    .build();
        }
        int target = targetLevel(level);

        Map<Lift, BigDecimal> estimates = new EnumMap<>(Lift.class);
        for (WorkoutSet set : recentSets(userId)) {
            Optional<Lift> lift = Lift.resolve(set.getExerciseName());
            if (lift.isEmpty() || set.getWeightKg() == null || set.getReps() == null || set.getReps() < 1) {
                continue;
            }
            BigDecimal estimate = epley(set.getWeightKg(), set.getReps());
            estimates.merge(lift.get(), estimate, BigDecimal::max);
        }

        List<PromotionReadinessVO.LiftReadiness> lifts = new ArrayList<>();
        BigDecimal overall = null;
        boolean allReady = true;
        for (Lift lift : Lift.values()) {
            BigDecimal required = requiredLoad(profile.getHeightCm(), target, lift);
            BigDecimal estimate = estimates.get(lift);
            boolean ready = estimate != null && estimate.compareTo(required) >= 0;
            BigDecimal ratio = estimate == null ? BigDecimal.ZERO : estimate.divide(required, 2, RoundingMode.HALF_UP);
            overall = overall == null ? ratio : overall.min(ratio);
            lifts.add(new PromotionReadinessVO.LiftReadiness(lift, estimate, required, ready));
            allReady &= ready;
        }

        return PromotionReadinessVO.builder()
                .currentLevel(level)
                .targetLevel(target)
                .ready(allReady)
                .overallRatio(overall)
                .lifts(lifts)
                .message(allReady
                        ? "Your logged lifts meet the level " + target + " requirements; take the test"
                        : "Keep training; not every lift reaches the level " + target + " requirement yet")
                .build();
    }

    // ================= helpers =================

    /**
     * (height - 100 + lift offset) * ratio(target), 1 decimal HALF_UP
     */
    static BigDecimal requiredLoad(BigDecimal heightCm, int targetLevel, Lift lift) {
        BigDecimal height = heightCm != null ? heightCm : BigDecimal.valueOf(LevelConstants.DEFAULT_HEIGHT_CM);
        BigDecimal base = height.subtract(HEIGHT_BASE_OFFSET).add(BigDecimal.valueOf(lift.getBaseOffsetKg()));
        return base.multiply(BigDecimal.valueOf(LevelConstants.levelTestRatio(targetLevel, lift)))
                .setScale(1, RoundingMode.HALF_UP);
    }

    /**
     * Epley: w * (1 + reps / 30)
     */
    static BigDecimal epley(BigDecimal weightKg, int reps) {
        BigDecimal factor = BigDecimal.ONE.add(BigDecimal.valueOf(reps).divide(BigDecimal.valueOf(30), 6, RoundingMode.HALF_UP));
        return weightKg.multiply(factor).setScale(1, RoundingMode.HALF_UP);
    }

    private static int targetLevel(int level) {
        return Math.min(level + 1, LevelConstants.MAX_LEVEL);
    }

    private static Map<Lift, BigDecimal> bestAttempts(LevelTestSubmissionDTO submission) {
        Map<Lift, BigDecimal> best = new EnumMap<>(Lift.class);
        if (submission == null || submission.getLifts() == null) {
            return best;
        }
        for (LevelTestSubmissionDTO.LiftAttempt attempt : submission.getLifts()) {
            if (attempt == null || attempt.getWeightKg() == null || attempt.getReps() == null || attempt.getReps() < 1) {
                continue;
            }
            Optional<Lift> lift = Lift.resolve(attempt.getExerciseType());
            if (lift.isEmpty()) {
                log.debug("Ignoring unknown lift type: {}", attempt.getExerciseType());
                continue;
            }
            best.merge(lift.get(), BigDecimal.valueOf(attempt.getWeightKg()), BigDecimal::max);
        }
        return best;
    }

    private static String feedback(boolean passed, int target, Tier newTier, List<LevelTestResultVO.LiftResult> results) {
        if (passed) {
            return String.format("Congratulations! You passed and are now level %d (%s).", target, newTier.getLabel());
        }
        StringBuilder sb = new StringBuilder("Not passed this time. Still missing: ");
        List<String> gaps = new ArrayList<>();
        for (LevelTestResultVO.LiftResult r : results) {
            if (!r.isPassed()) {
                gaps.add(String.format("%s %skg", r.getLift().getDisplayName(), r.getGapKg().toPlainString()));
            }
        }
        sb.append(String.join(", ", gaps)).append('.');
        return sb.toString();
    }

    private static List<String> nextSteps(boolean passed, List<LevelTestResultVO.LiftResult> results) {
        if (passed) {
            return List.of("Your routines now follow the new level's program.");
        }
        List<String> steps = new ArrayList<>();
        for (LevelTestResultVO.LiftResult r : results) {
            if (!r.isPassed()) {
                steps.add(r.getLift().getNextStep());
            }
        }
        steps.add("Retest after " + LevelConstants.LEVEL_TEST_COOLDOWN_DAYS + " days.");
        return steps;
    }

    /**
     * Store failures surface as a fixed message; driver text only goes to the log.
     */
    private UserProfile requireProfile(Long userId) {
        UserProfile profile;
        try {
            profile = userProfileMapper.selectByUserId(userId);
        } catch (RuntimeException e) {
            log.error("Profile lookup failed, userId={}", userId, e);
            throw new IllegalStateException(PROFILE_LOOKUP_FAILED, e);
        }
        if (profile == null) {
            throw new IllegalStateException("No profile found for this user");
        }
        return profile;
    }

    private List<WorkoutSet> recentSets(Long userId) {
        try {
            List<WorkoutSet> sets = workoutSessionMapper.selectSetsSince(userId, LocalDateTime.now().minusWeeks(READINESS_WEEKS));
            return sets != null ? sets : Collections.emptyList();
        } catch (Exception e) {
            log.warn("Workout history lookup failed, userId={}: {}", userId, e.getMessage());
            return Collections.emptyList();
        }
    }

    private static EligibilityVO.EligibilityVOBuilder ineligible(IneligibilityReason reason, String message, Integer level) {
        return EligibilityVO.builder()
                .eligible(false)
                .reason(reason)
                .message(message)
                .currentLevel(level)
                .targetLevel(level != null ? targetLevel(level) : null);
    }
}
