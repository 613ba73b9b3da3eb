package com.witty.interfaces.api.formalize;

import com.witty.application.formalize.FormalizationAppService;
import com.witty.application.formalize.FormalizeOptionsFactory;
import com.witty.domain.formalize.model.FormalizationResult;
import com.witty.domain.formalize.model.FormalizeOptions;
import com.witty.interfaces.api.dto.FormalizeRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/formalize")
@RequiredArgsConstructor
public class FormalizeController {

    private final FormalizationAppService formalizationAppService;
    private final FormalizeOptionsFactory optionsFactory;

    @PostMapping
    public ResponseEntity<FormalizationResult> formalize(@Valid @RequestBody FormalizeRequest request) {
        FormalizeOptions options = optionsFactory.resolve(
                request.privacyMode(),
                request.reproducibleMode(),
                request.salt(),
                request.retrievalEnabled(),
                request.topKSymbolizations());

        return ResponseEntity.ok(formalizationAppService.formalize(request.text(), options));
    }
}
