package com.example.vexreport.application.exception;

/**
 * Dedicated exception for invalid run settings such as an out-of-range job count or a missing input path.
 */
public class ConversionSettingsException extends UseCaseValidationException {

	/**
	 * @param message validation message suitable for display
	 */
    public ConversionSettingsException(String message) {
        super(message);
    }
}
