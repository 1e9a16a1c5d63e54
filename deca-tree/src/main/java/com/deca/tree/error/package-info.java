/**
 * Error kinds and the exception that carries them.
 */
package com.deca.tree.error;
