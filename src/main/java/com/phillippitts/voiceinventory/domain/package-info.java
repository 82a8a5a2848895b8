/**
 * Inventory domain records and enumerations.
 *
 * <p>Records are immutable. Resolvable records implement
 * {@link com.phillippitts.voiceinventory.domain.NamedEntity}.
 */
package com.phillippitts.voiceinventory.domain;
