package com.repstack.model.program;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.repstack.model.enums.Tier;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TierProgram {

    private Tier tier;

    /**
     * number of distinct weeks before the program repeats
     */
    private int cycleWeeks;

    private List<ProgramTemplate> days = new ArrayList<>();
}
