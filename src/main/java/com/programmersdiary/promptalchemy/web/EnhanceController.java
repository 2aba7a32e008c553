package com.programmersdiary.promptalchemy.web;

import com.programmersdiary.promptalchemy.enhance.EnhancementRequest;
import com.programmersdiary.promptalchemy.enhance.EnhancementResult;
import com.programmersdiary.promptalchemy.enhance.EnhancementService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/enhance")
public class EnhanceController {

    private final EnhancementService enhancementService;

    public EnhanceController(EnhancementService enhancementService) {
        this.enhancementService = enhancementService;
    }

    @PostMapping
    public EnhancementResult enhance(@RequestBody EnhancementRequest request) {
        return enhancementService.enhance(request);
    }
}
