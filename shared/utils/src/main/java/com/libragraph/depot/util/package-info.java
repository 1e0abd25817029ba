/**
 * Shared utilities for all Depot modules.
 *
 * <p>Contains {@link com.libragraph.depot.util.FileId} and the entry naming
 * helpers used by downloads. No framework dependencies, pure Java.
 */
package com.libragraph.depot.util;
