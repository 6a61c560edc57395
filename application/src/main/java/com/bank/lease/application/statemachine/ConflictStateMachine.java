package com.bank.lease.application.statemachine;

import com.bank.lease.domain.enums.ConflictStatus;
import com.bank.lease.domain.enums.ResolutionDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * State machine for the conflict lifecycle
 *
 * Transitions:
 * - OPEN + RESOLVE -> RESOLVED
 * - OPEN + IGNORE  -> IGNORED
 * - repeating the transition that produced a terminal state is a no-op
 * - anything else is rejected
 */
@Component
public class ConflictStateMachine {

    private static final Logger log = LoggerFactory.getLogger(ConflictStateMachine.class);

    /**
     * Events that can trigger state transitions
     */
    public enum Event {
        RESOLVE,
        IGNORE
    }

    /**
     * Result of a state transition attempt
     */
    public static class TransitionResult {
        private final ConflictStatus newState;
        private final boolean valid;
        private final String errorMessage;
        private final boolean stateChanged;

        private TransitionResult(ConflictStatus newState, boolean valid, String errorMessage, boolean stateChanged) {
            this.newState = newState;
            this.valid = valid;
            this.errorMessage = errorMessage;
            this.stateChanged = stateChanged;
        }

        public static TransitionResult success(ConflictStatus newState, boolean stateChanged) {
            return new TransitionResult(newState, true, null, stateChanged);
        }

        public static TransitionResult failure(String errorMessage) {
            return new TransitionResult(null, false, errorMessage, false);
        }

        public ConflictStatus getNewState() {
            return newState;
        }

        public boolean isValid() {
            return valid;
        }

        public String getErrorMessage() {
            return errorMessage;
        }

        public boolean isStateChanged() {
            return stateChanged;
        }
    }

    public TransitionResult transition(ConflictStatus currentState, Event event) {
        log.debug("Conflict transition: {} + {}", currentState, event);

        if (currentState == null || event == null) {
            return TransitionResult.failure("Conflict status and event are required");
        }

        ConflictStatus target = targetOf(event);
        if (currentState == ConflictStatus.OPEN) {
            return TransitionResult.success(target, true);
        }
        if (currentState == target) {
            return TransitionResult.success(target, false);
        }
        return TransitionResult.failure(
                String.format("Cannot %s a conflict that is already %s",
                        event.name().toLowerCase(), currentState.getCode()));
    }

    public Event fromDecision(ResolutionDecision decision) {
        if (decision == null) {
            return null;
        }
        return switch (decision) {
            case RESOLVE -> Event.RESOLVE;
            case IGNORE -> Event.IGNORE;
        };
    }

    private static ConflictStatus targetOf(Event event) {
        return switch (event) {
            case RESOLVE -> ConflictStatus.RESOLVED;
            case IGNORE -> ConflictStatus.IGNORED;
        };
    }
}
