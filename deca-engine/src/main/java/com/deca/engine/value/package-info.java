/**
 * Value layer derivation. Entry point is {@link com.deca.engine.value.ValueLoader}.
 */
package com.deca.engine.value;
