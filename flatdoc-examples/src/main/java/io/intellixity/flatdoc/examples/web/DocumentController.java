package io.intellixity.flatdoc.examples.web;

import io.intellixity.flatdoc.examples.service.DocumentService;
import io.intellixity.flatdoc.persistence.exec.StoredDocument;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/documents")
public final class DocumentController {
  private final DocumentService documents;

  public DocumentController(DocumentService documents) {
    this.documents = documents;
  }

  public record Stored(String rowId) {}

  public record Affected(long rows) {}

  @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
  @ResponseStatus(HttpStatus.CREATED)
  public Stored store(@RequestParam("collection") String collection, @RequestBody Map<String, Object> document) {
    return new Stored(documents.store(collection, document));
  }

  @GetMapping
  public List<StoredDocument> list(@RequestParam("collection") String collection,
                                   @RequestParam(value = "orderBy", required = false) String orderBy,
                                   @RequestParam(value = "direction", required = false) String direction,
                                   @RequestParam(value = "page", required = false) Integer page,
                                   @RequestParam(value = "size", required = false) Integer size) {
    return documents.list(collection, orderBy, direction, page, size);
  }

  @GetMapping("/count")
  public long count(@RequestParam("collection") String collection) {
    return documents.count(collection);
  }

  @GetMapping("/{id}")
  public StoredDocument get(@RequestParam("collection") String collection, @PathVariable("id") String id) {
    return documents.get(collection, id);
  }

  @PostMapping("/search")
  public List<StoredDocument> search(@RequestParam("collection") String collection,
                                     @RequestParam("where") String where) {
    return documents.search(collection, where);
  }

  @PutMapping(value = "/{id}", consumes = MediaType.APPLICATION_JSON_VALUE)
  public Affected updateById(@RequestParam("collection") String collection, @PathVariable("id") String id,
                             @RequestBody Map<String, Object> partial) {
    return new Affected(documents.updateById(collection, id, partial));
  }

  @PatchMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
  public Affected update(@RequestParam("collection") String collection, @RequestParam("where") String where,
                         @RequestBody Map<String, Object> partial) {
    return new Affected(documents.update(collection, where, partial));
  }

  @DeleteMapping("/{id}")
  public Affected deleteById(@RequestParam("collection") String collection, @PathVariable("id") String id) {
    return new Affected(documents.deleteById(collection, id));
  }

  @DeleteMapping
  public Affected delete(@RequestParam("collection") String collection, @RequestParam("where") String where) {
    return new Affected(documents.delete(collection, where));
  }
}
