package com.anamnesis.worker;

import com.anamnesis.parser.FormatTag;

/**
 * Result of a detect call; a null format means no known format matched.
 */
public record FormatDetection(FormatTag format) {
}
