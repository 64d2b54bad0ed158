/**
 * DCB execution result types.
 *
 * <p>{@link com.ryuqq.dcb.core.result.DcbExecutionResult} is a closed sum type. Every domain
 * outcome of an execution, including format errors, missing entities and concurrency conflicts,
 * is returned as one of its variants. Exceptions are reserved for wiring errors.</p>
 *
 * @since 1.0.0
 * @author DCB Team
 */
package com.ryuqq.dcb.core.result;
