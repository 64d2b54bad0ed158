/**
 * Execution request contract.
 *
 * <p>{@link com.ryuqq.dcb.core.contract.DcbExecution} bundles the scope key, OCC baseline,
 * event tagging parameters and host collaborators of a single multi-entity decision. Wiring
 * errors surface as {@link java.lang.IllegalArgumentException} at construction; the scope key
 * format is checked at execution time and reported as a rejected result.</p>
 *
 * @since 1.0.0
 * @author DCB Team
 */
package com.ryuqq.dcb.core.contract;
