package com.boardpilot.lifecycle.service;

import com.boardpilot.lifecycle.model.TaskStatus;
import com.boardpilot.lifecycle.model.TriggerType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransitionValidatorTest {

    private final TransitionValidator validator = new TransitionValidator();

    @ParameterizedTest
    @EnumSource(TaskStatus.class)
    void validate_sameStatus_isAllowed(TaskStatus status) {
        assertThatCode(() -> validator.validate(status, status)).doesNotThrowAnyException();
    }

    @Test
    void validate_completedToProcessing_alwaysFails() {
        assertThatThrownBy(() -> validator.validate(TaskStatus.COMPLETED, TaskStatus.PROCESSING))
                .isInstanceOf(IllegalTransitionException.class)
                .satisfies(e -> {
                    IllegalTransitionException ite = (IllegalTransitionException) e;
                    assertThat(ite.getFrom()).isEqualTo(TaskStatus.COMPLETED);
                    assertThat(ite.getTo()).isEqualTo(TaskStatus.PROCESSING);
                });
    }

    @ParameterizedTest
    @EnumSource(value = TaskStatus.class, names = "COMPLETED", mode = EnumSource.Mode.EXCLUDE)
    void validate_nothingLeavesCompleted(TaskStatus target) {
        assertThatThrownBy(() -> validator.validate(TaskStatus.COMPLETED, target))
                .isInstanceOf(IllegalTransitionException.class);
    }

    @Test
    void validate_skippingAheadFromPending_fails() {
        assertThatThrownBy(() -> validator.validate(TaskStatus.PENDING, TaskStatus.TESTING))
                .isInstanceOf(IllegalTransitionException.class)
                .hasMessageContaining("PENDING -> TESTING");
    }

    @Test
    void validateReentry_manualOutOfCompleted_isRestart() {
        assertThat(validator.validateReentry(TaskStatus.COMPLETED, TaskStatus.PROCESSING, TriggerType.MANUAL))
                .isTrue();
        assertThat(validator.validateReentry(TaskStatus.COMPLETED, TaskStatus.PENDING, TriggerType.MANUAL))
                .isTrue();
    }

    @Test
    void validateReentry_otherTriggersCannotLeaveCompleted() {
        assertThatThrownBy(() ->
                validator.validateReentry(TaskStatus.COMPLETED, TaskStatus.PROCESSING, TriggerType.WEBHOOK))
                .isInstanceOf(IllegalTransitionException.class);
        assertThatThrownBy(() ->
                validator.validateReentry(TaskStatus.COMPLETED, TaskStatus.TESTING, TriggerType.MANUAL))
                .isInstanceOf(IllegalTransitionException.class);
    }

    @ParameterizedTest
    @EnumSource(value = TaskStatus.class, names = {"COMPLETED", "FAILED"})
    void validateReentry_finishedTarget_isRejectedFromAnywhere(TaskStatus target) {
        for (TaskStatus current : TaskStatus.values()) {
            for (TriggerType trigger : TriggerType.values()) {
                assertThatThrownBy(() -> validator.validateReentry(current, target, trigger))
                        .as("%s -> %s via %s", current, target, trigger)
                        .isInstanceOf(IllegalTransitionException.class);
            }
        }
    }

    @Test
    void validateReentry_ordinaryMove_isNotRestart() {
        assertThat(validator.validateReentry(TaskStatus.FAILED, TaskStatus.PROCESSING, TriggerType.RETRY))
                .isFalse();
    }
}
