package dev.flowc.ir;

import java.util.List;

public record TopicFilter(int index, List<String> values) {}
