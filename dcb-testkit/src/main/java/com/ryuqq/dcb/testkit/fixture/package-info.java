/**
 * Recording test doubles for the DCB SPI.
 *
 * @author DCB Team
 * @since 1.0.0
 */
package com.ryuqq.dcb.testkit.fixture;
