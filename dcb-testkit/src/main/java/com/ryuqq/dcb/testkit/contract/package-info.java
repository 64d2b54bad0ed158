/**
 * Contract tests for DCB SPI implementations.
 *
 * <p>Adapter modules extend {@link
 * com.ryuqq.dcb.testkit.contract.AbstractScopeOperationsContractTest} from their test sources to
 * prove their scope store honors the OCC contract the execution engine relies on.</p>
 *
 * @author DCB Team
 * @since 1.0.0
 */
package com.ryuqq.dcb.testkit.contract;
