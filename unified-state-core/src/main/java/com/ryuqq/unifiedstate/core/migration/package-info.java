/**
 * 스키마 버전 마이그레이션.
 *
 * @since 1.0.0
 */
package com.ryuqq.unifiedstate.core.migration;
