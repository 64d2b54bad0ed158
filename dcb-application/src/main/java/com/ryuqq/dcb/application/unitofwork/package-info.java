/**
 * Two-phase update application.
 *
 * <p>The engine applies entity updates before the scope commit and never rolls them back. Hosts
 * without a transactional envelope wrap their applier in {@link
 * com.ryuqq.dcb.application.unitofwork.StagedUpdateApplier} so writes reach storage only after a
 * successful result.</p>
 *
 * @since 1.0.0
 * @author DCB Team
 */
package com.ryuqq.dcb.application.unitofwork;
