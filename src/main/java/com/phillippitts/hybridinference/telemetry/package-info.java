/**
 * Telemetry boundary: the serialized event payload and the sink contract.
 */
package com.phillippitts.hybridinference.telemetry;
