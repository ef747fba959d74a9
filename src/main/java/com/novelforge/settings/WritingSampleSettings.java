package com.novelforge.settings;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class WritingSampleSettings {
    private boolean enabled;
    private String customText;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getCustomText() {
        return customText;
    }

    public void setCustomText(String customText) {
        this.customText = customText;
    }

    /**
     * Style sample to inject into the writing prompt, or null when disabled or empty.
     */
    public String activeSample() {
        if (!enabled || customText == null || customText.isBlank()) {
            return null;
        }
        return customText.trim();
    }
}
