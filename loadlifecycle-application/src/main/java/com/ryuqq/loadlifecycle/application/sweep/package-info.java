/**
 * 주기 스윕 포트.
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
package com.ryuqq.loadlifecycle.application.sweep;
