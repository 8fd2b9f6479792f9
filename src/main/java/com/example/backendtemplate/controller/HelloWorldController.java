package com.example.backendtemplate.controller;

import com.example.backendtemplate.dto.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/hello-world")
@Tag(name = "Hello World")
public class HelloWorldController {

    @GetMapping
    @Operation(summary = "Hello world", description = "Smoke test endpoint")
    public ResponseEntity<ApiResponse<String>> helloWorld() {
        return ResponseEntity.ok(ApiResponse.success("Hello World", "Hello World"));
    }
}
