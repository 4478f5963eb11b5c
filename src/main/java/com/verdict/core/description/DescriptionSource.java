package com.verdict.core.description;

/**
 * Source of the description generated by the last matcher an example evaluated.
 * Used to name examples declared without a description.
 */
public interface DescriptionSource {

    /**
     * @return the last generated description, or {@code null} when nothing was recorded
     */
    String lastGeneratedDescription();

    void clear();
}
