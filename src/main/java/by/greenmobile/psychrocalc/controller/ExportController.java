package by.greenmobile.psychrocalc.controller;

import by.greenmobile.psychrocalc.entity.DesignRequest;
import by.greenmobile.psychrocalc.entity.DesignResult;
import by.greenmobile.psychrocalc.service.ChartSvgService;
import by.greenmobile.psychrocalc.service.DesignFacade;
import by.greenmobile.psychrocalc.service.report.PdfReportService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Design run rendered as a downloadable file. Same request body as POST /api/design.
 */
@RestController
@RequestMapping("/export")
@RequiredArgsConstructor
public class ExportController {

    private final DesignFacade designFacade;
    private final ChartSvgService chartSvgService;
    private final PdfReportService pdfReportService;

    @PostMapping("/svg")
    public ResponseEntity<byte[]> exportSvg(@Valid @RequestBody DesignRequest request) {
        DesignResult r = designFacade.solve(request);
        String svg = chartSvgService.generateSvg(r);

        byte[] bytes = svg.getBytes(StandardCharsets.UTF_8);
        return ResponseEntity.ok()
                .headers(fileHeaders("chart.svg"))
                .contentType(MediaType.valueOf("image/svg+xml"))
                .body(bytes);
    }

    @PostMapping("/pdf")
    public ResponseEntity<byte[]> exportPdf(@Valid @RequestBody DesignRequest request) throws IOException {
        DesignResult r = designFacade.solve(request);
        byte[] pdf = pdfReportService.buildDesignReport(r);

        return ResponseEntity.ok()
                .headers(fileHeaders("report.pdf"))
                .contentType(MediaType.APPLICATION_PDF)
                .body(pdf);
    }

    private HttpHeaders fileHeaders(String baseName) {
        String ts = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss"));
        String name = baseName.replace(".", "_" + ts + ".");

        HttpHeaders h = new HttpHeaders();
        h.setContentDisposition(ContentDisposition.attachment().filename(name, StandardCharsets.UTF_8).build());
        h.setCacheControl("no-cache, no-store, must-revalidate");
        h.setPragma("no-cache");
        return h;
    }
}
