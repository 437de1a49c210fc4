package com.farearound.search.controller.v1;

import com.farearound.search.dto.AffiliateInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Exposes the configured affiliate tracking identity to web clients.
 */
@Slf4j
@RestController
@RequestMapping("/api/affiliate")
public class AffiliateController {

    private final AffiliateInfo affiliateInfo;

    public AffiliateController(
            @Value("${affiliate.id:}") String affiliateId,
            @Value("${affiliate.domain:}") String domain) {
        this.affiliateInfo = AffiliateInfo.builder()
                .affiliateId(StringUtils.hasText(affiliateId) ? affiliateId : null)
                .domain(StringUtils.hasText(domain) ? domain : null)
                .build();
    }

    @GetMapping("/info")
    public ResponseEntity<AffiliateInfo> info() {
        log.debug("GET /api/affiliate/info");
        return ResponseEntity.ok(affiliateInfo);
    }
}
