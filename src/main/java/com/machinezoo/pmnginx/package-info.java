// Part of PMNginx
/**
 * Main PMNginx package.
 * Configuration text is parsed by {@link com.machinezoo.pmnginx.ConfParser} and turned into
 * {@link com.machinezoo.pmnginx.ServerConfig} by {@link com.machinezoo.pmnginx.ServerConfigs}.
 * Requests are routed by {@link com.machinezoo.pmnginx.LocationMatcher} and {@link com.machinezoo.pmnginx.StaticResolver}.
 * Everything is served by {@link com.machinezoo.pmnginx.NginxServer}.
 */
package com.machinezoo.pmnginx;
