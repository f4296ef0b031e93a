/**
 * Guard evaluation SPI and dispatch table.
 *
 * @since 1.0.0
 * @author LoadLifecycle Team
 */
package com.ryuqq.loadlifecycle.core.guard;
