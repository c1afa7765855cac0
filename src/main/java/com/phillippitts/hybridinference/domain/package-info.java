/**
 * Immutable value types shared by the routing core: policies, decisions, options and results.
 */
package com.phillippitts.hybridinference.domain;
