package com.ryuqq.dcb.core.statemachine;

/**
 * 실행 단계 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>VALIDATE → OCC_PRE_CHECK, LOAD, REJECTED</li>
 *   <li>OCC_PRE_CHECK → LOAD, CONFLICT</li>
 *   <li>LOAD → DECIDE, REJECTED</li>
 *   <li>DECIDE → APPLY, REJECTED, FAILED</li>
 *   <li>APPLY → OCC_COMMIT, COMMITTED</li>
 *   <li>OCC_COMMIT → COMMITTED, CONFLICT</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 단계에서는 어떤 단계로도 전이 불가</li>
 *   <li>REJECTED/FAILED 이후 APPLY 불가 (거절은 부수 효과 없음)</li>
 * </ul>
 *
 * @author DCB Team
 * @since 1.0.0
 */
public final class PhaseTransition {

    // Utility class - prevent instantiation
    private PhaseTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 단계 전이가 유효한지 검증.
     *
     * @param from 현재 단계
     * @param to 전이할 단계
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(ExecutionPhase from, ExecutionPhase to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Phases cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal phase: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case VALIDATE -> to == ExecutionPhase.OCC_PRE_CHECK
                || to == ExecutionPhase.LOAD
                || to == ExecutionPhase.REJECTED;
            case OCC_PRE_CHECK -> to == ExecutionPhase.LOAD || to == ExecutionPhase.CONFLICT;
            case LOAD -> to == ExecutionPhase.DECIDE || to == ExecutionPhase.REJECTED;
            case DECIDE -> to == ExecutionPhase.APPLY
                || to == ExecutionPhase.REJECTED
                || to == ExecutionPhase.FAILED;
            case APPLY -> to == ExecutionPhase.OCC_COMMIT || to == ExecutionPhase.COMMITTED;
            case OCC_COMMIT -> to == ExecutionPhase.COMMITTED || to == ExecutionPhase.CONFLICT;
            case REJECTED, FAILED, CONFLICT, COMMITTED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid phase transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 단계 전이 실행 (검증 후).
     *
     * @param current 현재 단계
     * @param next 다음 단계
     * @return 전이된 단계 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static ExecutionPhase transition(ExecutionPhase current, ExecutionPhase next) {
        validate(current, next);
        return next;
    }
}
