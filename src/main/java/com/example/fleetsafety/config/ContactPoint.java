package com.example.fleetsafety.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContactPoint {

    private String name;
    private String phone;
    private String whatsapp;
    private Integer priority;
}
