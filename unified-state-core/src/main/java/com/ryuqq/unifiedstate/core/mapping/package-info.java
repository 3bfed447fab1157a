/**
 * {@link com.ryuqq.unifiedstate.core.spi.StateMapping} 조합기.
 *
 * @since 1.0.0
 */
package com.ryuqq.unifiedstate.core.mapping;
