package com.blockflow.blockflow_backend.executor;

import com.blockflow.blockflow_backend.config.BlockflowProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

@Component
@RequiredArgsConstructor
public class HttpFileUploadClient implements FileUploadClient {

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT = new ParameterizedTypeReference<>() {};

    private final RestTemplate restTemplate;
    private final BlockflowProperties properties;

    @Override
    public Map<String, Object> upload(ChatFile file, String workflowId, String executionId) {
        String url = properties.getExecutor().getBaseUrl() + "/api/files/upload";

        MultiValueMap<String, Object> form = new LinkedMultiValueMap<>();
        form.add("file", new ByteArrayResource(file.content()) {
            @Override
            public String getFilename() {
                return file.name();
            }
        });
        form.add("context", "execution");
        form.add("workflowId", workflowId);
        form.add("executionId", executionId);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);
        try {
            ResponseEntity<Map<String, Object>> response =
                    restTemplate.exchange(url, HttpMethod.POST, new HttpEntity<>(form, headers), JSON_OBJECT);
            Map<String, Object> body = response.getBody();
            if (body == null) {
                throw new FileUploadException("Failed to upload " + file.name() + ": empty response");
            }
            return body;
        } catch (HttpStatusCodeException e) {
            throw new FileUploadException("Failed to upload " + file.name() + ": "
                    + e.getStatusCode().value() + " " + e.getResponseBodyAsString());
        }
    }
}
