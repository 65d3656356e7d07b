package com.textidy.interfaces.api.format;

import com.textidy.application.format.FormatAppService;
import com.textidy.domain.format.model.CheckResult;
import com.textidy.domain.format.model.FormatResult;
import com.textidy.interfaces.api.dto.CheckRequest;
import com.textidy.interfaces.api.dto.CheckResponse;
import com.textidy.interfaces.api.dto.FormatRequest;
import com.textidy.interfaces.api.dto.FormatResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class FormatController {

    private final FormatAppService formatAppService;

    @PostMapping("/format")
    public ResponseEntity<FormatResponse> format(@Valid @RequestBody FormatRequest request) {
        FormatResult result = formatAppService.format(request.text(), request.options());
        return ResponseEntity.ok(FormatResponse.from(result));
    }

    @PostMapping("/check")
    public ResponseEntity<CheckResponse> check(@Valid @RequestBody CheckRequest request) {
        CheckResult result = formatAppService.check(request.text());
        return ResponseEntity.ok(CheckResponse.from(result));
    }
}
