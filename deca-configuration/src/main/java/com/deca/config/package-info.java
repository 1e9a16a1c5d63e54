/**
 * Engine configuration.
 * <ul>
 *   <li>{@link com.deca.config.EngineLimits} – shape and base size caps</li>
 *   <li>{@link com.deca.config.EngineConfig} – limits plus mass point and evaluation switches, from builder or environment</li>
 * </ul>
 */
package com.deca.config;
