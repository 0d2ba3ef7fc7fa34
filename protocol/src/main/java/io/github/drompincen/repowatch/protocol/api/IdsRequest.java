package io.github.drompincen.repowatch.protocol.api;

import java.util.List;

public record IdsRequest(List<String> ids) {}
