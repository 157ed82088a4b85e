package com.ttennebkram.spectral.processors;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Annotation for spectral processor classes to declare their metadata.
 * The host reads it at runtime to list and label the nodes.
 *
 * Example usage:
 * <pre>
 * {@literal @}ProcessorInfo(
 *     nodeType = "FourierTransform",
 *     displayName = "Fourier Transform",
 *     category = "Frequency",
 *     outputCount = 2
 * )
 * public class FourierTransformProcessor extends SpectralProcessorBase { ... }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface ProcessorInfo {

    /**
     * The node type name (e.g., "FourierTransform").
     * Must match the nodeType used in serialization.
     */
    String nodeType();

    /**
     * Display name shown in the node title.
     * If empty, defaults to nodeType.
     */
    String displayName() default "";

    /**
     * Category for grouping (e.g., "Frequency").
     */
    String category();

    /**
     * Description shown in tooltips.
     */
    String description() default "";

    /**
     * Whether this is a dual-input processor.
     */
    boolean dualInput() default false;

    /**
     * Number of outputs this node produces.
     */
    int outputCount() default 1;
}
