package com.ryuqq.lockfile.adapter.filesystem.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.ryuqq.lockfile.core.spi.DocumentRepository;
import com.ryuqq.lockfile.core.store.DocumentParseException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Jackson 기반 {@link DocumentRepository} 구현체.
 *
 * <p>백업 문서는 UTF-8 JSON 객체이며 {@link LinkedHashMap}으로 읽어 키 순서를 보존합니다.
 * 쓰기는 pretty printer로 직렬화한 뒤 {@link AtomicFileWriter}로 원자적으로 교체합니다.</p>
 *
 * <p><strong>읽기 규칙:</strong></p>
 * <ul>
 *   <li>파일 없음 또는 공백뿐인 파일: {@link Optional#empty()}</li>
 *   <li>JSON 문법 오류: {@link DocumentParseException}</li>
 *   <li>최상위 값이 객체가 아님: {@link DocumentParseException}</li>
 * </ul>
 *
 * <p>숫자는 Jackson 기본 매핑을 따릅니다 (정수는 Integer/Long/BigInteger, 실수는 Double).</p>
 *
 * @author Lockfile Team
 * @since 1.0.0
 */
public class JacksonDocumentRepository implements DocumentRepository {

    private static final TypeReference<LinkedHashMap<String, Object>> DOCUMENT_TYPE =
        new TypeReference<LinkedHashMap<String, Object>>() {};

    private final ObjectMapper objectMapper;
    private final ObjectWriter prettyWriter;
    private final AtomicFileWriter fileWriter;

    public JacksonDocumentRepository() {
        this(new ObjectMapper(), new AtomicFileWriter());
    }

    /**
     * 생성자.
     *
     * @param objectMapper JSON 매퍼
     * @param fileWriter 원자적 파일 교체기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public JacksonDocumentRepository(ObjectMapper objectMapper, AtomicFileWriter fileWriter) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        if (fileWriter == null) {
            throw new IllegalArgumentException("fileWriter cannot be null");
        }
        this.objectMapper = objectMapper;
        this.prettyWriter = objectMapper.writerWithDefaultPrettyPrinter();
        this.fileWriter = fileWriter;
    }

    @Override
    public Optional<Map<String, Object>> read(Path path) throws IOException {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }

        String text;
        try {
            text = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
        if (text.isBlank()) {
            return Optional.empty();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new DocumentParseException(path, "Invalid JSON document", e);
        }
        if (root == null || !root.isObject()) {
            throw new DocumentParseException(path, "Top-level JSON value is not an object");
        }
        return Optional.of(objectMapper.convertValue(root, DOCUMENT_TYPE));
    }

    /**
     * 문서를 직렬화하여 원자적으로 교체.
     *
     * <p>반환값은 기록한 바이트를 다시 역직렬화한 문서로, 이후 {@link #read}의 결과와 같습니다
     * (예: 작은 Long은 Integer로, Float은 Double로).</p>
     *
     * @throws IOException 직렬화 불가능한 값이 있거나 (JsonProcessingException) 쓰기에 실패한 경우
     */
    @Override
    public Map<String, Object> write(Path path, Map<String, Object> document) throws IOException {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (document == null) {
            throw new IllegalArgumentException("document cannot be null");
        }
        byte[] content = prettyWriter.writeValueAsBytes(document);
        fileWriter.write(path, content);
        return objectMapper.readValue(content, DOCUMENT_TYPE);
    }

    @Override
    public boolean exists(Path path) {
        return Files.exists(path);
    }
}
