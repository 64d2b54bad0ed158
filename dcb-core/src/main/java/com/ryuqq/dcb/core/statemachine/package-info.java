/**
 * Execution phase state machine.
 *
 * <p>{@link com.ryuqq.dcb.core.statemachine.ExecutionPhase} enumerates the phases a single DCB
 * execution passes through; {@link com.ryuqq.dcb.core.statemachine.PhaseTransition} rejects any
 * out-of-order step with an {@link java.lang.IllegalStateException}.</p>
 *
 * @since 1.0.0
 * @author DCB Team
 */
package com.ryuqq.dcb.core.statemachine;
