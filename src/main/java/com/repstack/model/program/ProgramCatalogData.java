package com.repstack.model.program;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of programs/program-catalog.json.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProgramCatalogData {

    private String version;

    private List<TierProgram> programs = new ArrayList<>();
}
