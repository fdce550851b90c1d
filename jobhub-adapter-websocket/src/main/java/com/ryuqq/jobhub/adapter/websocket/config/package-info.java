/**
 * Server configuration loaded from {@code jobhub.properties} and the environment.
 */
package com.ryuqq.jobhub.adapter.websocket.config;
