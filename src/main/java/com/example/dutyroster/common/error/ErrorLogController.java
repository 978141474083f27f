package com.example.dutyroster.common.error;

import com.example.dutyroster.common.ApiResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/admin/errors")
public class ErrorLogController {

    private final ErrorLogBuffer errorLogBuffer;

    public ErrorLogController(ErrorLogBuffer errorLogBuffer) {
        this.errorLogBuffer = errorLogBuffer;
    }

    /**
     * 直近のエラーを新しい順に返す
     */
    @GetMapping
    public ResponseEntity<ApiResponse<List<ErrorLogBuffer.Entry>>> recent(
            @RequestParam(required = false) Integer limit) {
        List<ErrorLogBuffer.Entry> entries = limit == null ? errorLogBuffer.recent() : errorLogBuffer.recent(limit);
        return ResponseEntity.ok(ApiResponse.success("直近のエラー", entries,
                Map.of("capacity", errorLogBuffer.getCapacity())));
    }

    @DeleteMapping
    public ResponseEntity<ApiResponse<Void>> clear() {
        errorLogBuffer.clear();
        return ResponseEntity.ok(ApiResponse.success("エラーログをクリアしました", null));
    }
}
