package com.ryuqq.dcb.core.spi;

/**
 * Entity update application SPI.
 *
 * <p>Called once per entry of a successful decision's state updates, in insertion order, before
 * the scope commit. Hosts that need all-or-nothing semantics across the apply and commit steps
 * either run the execution inside a transaction or buffer updates with a staged applier.</p>
 *
 * @param <S> entity snapshot type
 * @param <U> update type
 * @author DCB Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface UpdateApplier<S, U> {

    /**
     * Applies one entity update.
     *
     * @param update the update with its pre-decision snapshot and target scope version
     */
    void apply(EntityUpdate<S, U> update);
}
