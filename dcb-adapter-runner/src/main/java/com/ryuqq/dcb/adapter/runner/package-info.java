/**
 * DCB runner adapters.
 *
 * <ul>
 *   <li>{@link com.ryuqq.dcb.adapter.runner.DcbExecutionRunner} - the execution engine</li>
 *   <li>{@link com.ryuqq.dcb.adapter.runner.ConflictRetryRunner} - opt-in caller-level conflict retry</li>
 *   <li>{@link com.ryuqq.dcb.adapter.runner.BackoffCalculator} - exponential backoff with jitter</li>
 * </ul>
 *
 * <p>Runtime classes log through SLF4J; hosts bind their own backend.</p>
 *
 * @since 1.0.0
 * @author DCB Team
 */
package com.ryuqq.dcb.adapter.runner;
