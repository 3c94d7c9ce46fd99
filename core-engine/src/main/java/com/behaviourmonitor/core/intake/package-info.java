/**
 * Event intake: validation and normalisation of raw behaviour events.
 *
 * @since 1.0.0
 */
package com.behaviourmonitor.core.intake;
