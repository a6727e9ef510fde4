package com.ttennebkram.blobfinder.processors;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Annotation for pipeline stage classes to declare their metadata.
 * StageProcessorBase reads it at runtime to answer getNodeType() and friends.
 *
 * Example usage:
 * <pre>
 * {@literal @}StageInfo(
 *     nodeType = "Blur",
 *     displayName = "Blur",
 *     category = "Blur",
 *     description = "Softens an image\nImgproc.GaussianBlur(src, dst, ksize, sigma)"
 * )
 * public class BlurProcessor extends StageProcessorBase { ... }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface StageInfo {

    /**
     * The node type name (e.g., "Blur", "HSLThreshold").
     * Used as the "type" key when the pipeline is described as JSON.
     */
    String nodeType();

    /**
     * Display name. If empty, defaults to nodeType.
     */
    String displayName() default "";

    /**
     * Category for grouping (e.g., "Blur", "Color", "Detection").
     */
    String category();

    /**
     * Description/method signature.
     */
    String description() default "";

    /**
     * Whether this stage takes two input images.
     */
    boolean dualInput() default false;
}
