package com.example.notebookengine.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReorderRequest {

    /** Every cell id of the notebook, in the new order */
    private List<String> cellIds;
}
