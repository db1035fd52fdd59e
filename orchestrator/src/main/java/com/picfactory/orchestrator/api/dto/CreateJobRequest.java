package com.picfactory.orchestrator.api.dto;

import com.picfactory.orchestrator.model.ReferenceInput;

import java.util.List;

/**
 * Request body for POST /jobs.
 *
 * Required: refs (each with a filePath), prompts
 * Optional: fileName per ref (defaults to the last path segment), outputDir
 *   (defaults to ~/Downloads/PicFactory/job-&lt;date&gt;)
 */
public record CreateJobRequest(List<Ref> refs, List<String> prompts, String outputDir) {

    public record Ref(String filePath, String fileName) {}

    public List<ReferenceInput> referenceInputs() {
        if (refs == null) {
            return List.of();
        }
        return refs.stream()
                .filter(r -> r != null)
                .map(r -> new ReferenceInput(r.filePath(), r.fileName()))
                .toList();
    }
}
