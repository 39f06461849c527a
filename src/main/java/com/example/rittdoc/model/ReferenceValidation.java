package com.example.rittdoc.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReferenceValidation {
    private boolean ok;
    private List<ReferenceProblem> problems = new ArrayList<>();

    public long count(ReferenceProblem.Type type) {
        return problems.stream().filter(p -> p.getType() == type).count();
    }
}
