/**
 * Time seams: wall clock and non-blocking delays.
 *
 * @since 1.0.0
 * @author JobHub Team
 */
package com.ryuqq.jobhub.core.time;
