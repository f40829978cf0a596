package com.example.filingcontacts.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CommandResult {
    private int exitCode;
    private String output;

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
