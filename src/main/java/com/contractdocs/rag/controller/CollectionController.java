package com.contractdocs.rag.controller;

import com.contractdocs.rag.model.CollectionInfo;
import com.contractdocs.rag.model.CollectionStats;
import com.contractdocs.rag.model.RagAnswer;
import com.contractdocs.rag.service.CollectionService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping("/collections")
@RequiredArgsConstructor
public class CollectionController {

    private final CollectionService collectionService;

    @GetMapping
    public ResponseEntity<List<CollectionResponse>> listCollections() {
        return ResponseEntity.ok(collectionService.listRegistered().stream()
            .map(CollectionResponse::from)
            .toList());
    }

    @GetMapping("/stats")
    public ResponseEntity<List<CollectionStats>> stats() {
        return ResponseEntity.ok(collectionService.listAllStats());
    }

    @GetMapping("/{name}")
    public ResponseEntity<CollectionInfo> describe(@PathVariable String name) {
        return ResponseEntity.ok(collectionService.describe(name));
    }

    @GetMapping("/{name}/search")
    public ResponseEntity<SearchResponse> search(
        @PathVariable String name,
        @RequestParam(name = "q") String query,
        @RequestParam(name = "k", required = false) @Min(0) @Max(100) Integer topK) {

        var result = collectionService.retrieve(name, query, Optional.ofNullable(topK));
        return ResponseEntity.ok(SearchResponse.from(result));
    }

    @PostMapping("/{name}/ask")
    public ResponseEntity<RagAnswer> ask(
        @PathVariable String name,
        @Valid @RequestBody AskRequest request) {

        return ResponseEntity.ok(collectionService.ask(name, request.question(), Optional.ofNullable(request.topK())));
    }
}
