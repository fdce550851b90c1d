/**
 * JSON wire codec for envelopes.
 *
 * @since 1.0.0
 * @author JobHub Team
 */
package com.ryuqq.jobhub.adapter.runner.codec;
