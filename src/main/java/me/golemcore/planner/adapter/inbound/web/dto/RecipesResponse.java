package me.golemcore.planner.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecipesResponse {
    private List<Map<String, String>> recipes;
    private List<Map<String, String>> dinnerHistory;
}
