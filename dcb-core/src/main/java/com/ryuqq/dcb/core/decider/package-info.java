/**
 * Decider outcome primitives package.
 *
 * <p>A decider is a pure function from (state, command, context) to a {@link
 * com.ryuqq.dcb.core.decider.DeciderOutput}. The three outcomes carry different side-effect
 * guarantees that every consumer must respect:</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.dcb.core.decider.DeciderSuccess} - events plus state delta</li>
 *   <li>{@link com.ryuqq.dcb.core.decider.DeciderRejected} - silent refusal, no event</li>
 *   <li>{@link com.ryuqq.dcb.core.decider.DeciderFailed} - recorded refusal, one event</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * String summary = output.match(
 *     success -&gt; "accepted: " + success.event().eventType(),
 *     rejected -&gt; "rejected: " + rejected.code(),
 *     failed -&gt; "failed: " + failed.reason()
 * );
 * </pre>
 *
 * <h2>Multi-entity Decisions</h2>
 * <p>{@link com.ryuqq.dcb.core.decider.DcbDecider} receives an {@link
 * com.ryuqq.dcb.core.decider.AggregatedState} and returns per-entity {@link
 * com.ryuqq.dcb.core.decider.StateUpdates}.</p>
 *
 * @since 1.0.0
 * @author DCB Team
 */
package com.ryuqq.dcb.core.decider;
