/**
 * Coded text types and the openEHR support terminology code sets used by change control.
 */
package com.ryuqq.changecontrol.core.terminology;
