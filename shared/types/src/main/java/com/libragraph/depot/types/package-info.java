/**
 * Pure Java value types shared across all Depot modules.
 *
 * <p>This module has no framework dependencies.
 */
package com.libragraph.depot.types;
