package com.nevis.vision.controller;

import com.nevis.vision.availability.BackendState;
import com.nevis.vision.exception.InvalidInputException;
import com.nevis.vision.model.ComparisonResult;
import com.nevis.vision.model.DeepfakeResult;
import com.nevis.vision.model.EmbeddingResult;
import com.nevis.vision.model.FaceEmbeddingResult;
import com.nevis.vision.model.ImageSource;
import com.nevis.vision.model.MatchTag;
import com.nevis.vision.model.ReverseSearchOptions;
import com.nevis.vision.model.ReverseSearchResult;
import com.nevis.vision.model.SortField;
import com.nevis.vision.model.SortOrder;
import com.nevis.vision.service.ServiceGateway;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@RestController
@RequestMapping("/vision")
@RequiredArgsConstructor
public class VisionController {

    private final ServiceGateway serviceGateway;

    @PostMapping(path = "/embeddings", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<EmbeddingResult> embedUpload(@RequestPart("image") MultipartFile image) {
        return ResponseEntity.ok(serviceGateway.embedImage(ImageSource.ofBytes(read(image))));
    }

    @PostMapping(path = "/embeddings", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<EmbeddingResult> embedUrl(@Valid @RequestBody EmbedUrlRequest request) {
        return ResponseEntity.ok(serviceGateway.embedImage(ImageSource.ofUrl(request.imageUrl())));
    }

    @PostMapping(path = "/faces/embedding", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<FaceEmbeddingResult> extractFace(@RequestPart("image") MultipartFile image) {
        return ResponseEntity.ok(serviceGateway.extractFaceEmbedding(read(image)));
    }

    @PostMapping(path = "/faces/compare", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ComparisonResult> compareFaces(@Valid @RequestBody CompareFacesRequest request) {
        return ResponseEntity.ok(serviceGateway.compareFaces(
            request.embedding1(), request.embedding2(), request.threshold()));
    }

    @PostMapping(path = "/deepfake", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<DeepfakeResult> detectDeepfake(@RequestPart("image") MultipartFile image) {
        return ResponseEntity.ok(serviceGateway.detectDeepfake(read(image)));
    }

    @PostMapping(path = "/reverse-search", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ReverseSearchResult> reverseSearchUpload(
        @RequestPart("image") MultipartFile image,
        @RequestParam(name = "limit", required = false) Integer limit,
        @RequestParam(name = "offset", required = false) Integer offset,
        @RequestParam(name = "sort", required = false) String sort,
        @RequestParam(name = "order", required = false) String order,
        @RequestParam(name = "domain", required = false) String domain,
        @RequestParam(name = "tags", required = false) List<String> tags) {

        ReverseSearchOptions options = options(limit, offset, sort, order, domain, tags);
        return ResponseEntity.ok(serviceGateway.searchReverseImage(ImageSource.ofBytes(read(image)), options));
    }

    @PostMapping(path = "/reverse-search", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ReverseSearchResult> reverseSearchUrl(@Valid @RequestBody ReverseSearchRequest request) {
        ReverseSearchOptions options = options(request.limit(), request.offset(), request.sort(),
            request.order(), request.domain(), request.tags());
        return ResponseEntity.ok(serviceGateway.searchReverseImage(ImageSource.ofUrl(request.imageUrl()), options));
    }

    @GetMapping("/availability")
    public ResponseEntity<Map<String, BackendState>> availability() {
        return ResponseEntity.ok(serviceGateway.availability());
    }

    private static ReverseSearchOptions options(Integer limit, Integer offset, String sort, String order,
                                                String domain, List<String> tags) {
        Set<MatchTag> tagFilter = EnumSet.noneOf(MatchTag.class);
        if (tags != null) {
            for (String tag : tags) {
                tagFilter.add(MatchTag.from(tag)
                    .orElseThrow(() -> new InvalidInputException("Unknown tag: " + tag)));
            }
        }
        return new ReverseSearchOptions(
            limit == null ? ReverseSearchOptions.DEFAULT_LIMIT : limit,
            offset == null ? 0 : offset,
            SortField.from(sort),
            SortOrder.from(order),
            domain == null || domain.isBlank() ? null : domain,
            tagFilter,
            null);
    }

    private static byte[] read(MultipartFile image) {
        try {
            return image.getBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read uploaded image", e);
        }
    }
}
