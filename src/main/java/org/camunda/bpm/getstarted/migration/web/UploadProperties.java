package org.camunda.bpm.getstarted.migration.web;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;
import java.util.Set;

/**
 * Settings for the upload endpoint. The size limit is Spring's own
 * {@code spring.servlet.multipart.max-file-size}.
 */
@Configuration
@ConfigurationProperties(prefix = "migration.upload")
@Getter
@Setter
public class UploadProperties {

    /** Directory uploads are stored in while they are analyzed */
    private String folder = "uploads";

    /** Accepted file extensions, lower case, without the dot */
    private Set<String> allowedExtensions = Set.of("bpmn", "xml");

    public boolean isAllowed(String filename) {
        int dot = filename.lastIndexOf('.');
        if (dot < 0) {
            return false;
        }
        return allowedExtensions.contains(filename.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
