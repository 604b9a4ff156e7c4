/*
 * どこで: Safety API
 * 何を: 処方解析/相互作用チェック/用量確認のエンドポイントを公開する
 * なぜ: 解析ワークフローの入口をクライアントへ提供するため
 */
package com.medsafe.safety.api;

import com.medsafe.safety.analysis.DosageVerification;
import com.medsafe.safety.api.request.AnalysisRequest;
import com.medsafe.safety.api.request.DosageCheckRequest;
import com.medsafe.safety.api.request.InteractionCheckRequest;
import com.medsafe.safety.api.response.AnalysisResponse;
import com.medsafe.safety.api.response.DosageCheckResponse;
import com.medsafe.safety.api.response.InteractionResponse;
import com.medsafe.safety.api.response.InteractionsResponse;
import com.medsafe.safety.workflow.PrescriptionWorkflowService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/analysis")
@RequiredArgsConstructor
public class AnalysisController {

  private final PrescriptionWorkflowService workflowService;

  @PostMapping
  public ResponseEntity<AnalysisResponse> analyze(@Valid @RequestBody AnalysisRequest request) {
    return ResponseEntity.ok(
        AnalysisResponse.from(workflowService.analyze(request.text(), request.confidence())));
  }

  @PostMapping("/interactions")
  public ResponseEntity<InteractionsResponse> checkInteractions(
      @Valid @RequestBody InteractionCheckRequest request) {
    return ResponseEntity.ok(
        new InteractionsResponse(
            workflowService.checkInteractions(request.medications()).stream()
                .map(InteractionResponse::from)
                .toList()));
  }

  @PostMapping("/dosage")
  public ResponseEntity<DosageCheckResponse> verifyDosage(
      @Valid @RequestBody DosageCheckRequest request) {
    final DosageVerification verification =
        workflowService.verifyDosage(request.medication(), request.amount());
    return ResponseEntity.ok(
        new DosageCheckResponse(
            request.medication(), verification.status().name(), verification.message()));
  }
}
