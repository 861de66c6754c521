package com.gt.lss.mastery.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(SpringExtension.class)
public class MasteryDaoPGTests {

    @Mock private NamedParameterJdbcTemplate template;

    private MasteryDaoPG masteryDao;

    @BeforeEach
    public void setup() {
        masteryDao = new MasteryDaoPG(template, 2);
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testFetchEnergies() {
        Map<String, Double> storedEnergies = Map.of("a", 0.5, "c", 0.9, "e", 0.1);

        // Each chunk answers with its rows in reverse order
        when(template.query(anyString(), anyMap(), any(RowMapper.class))).thenAnswer(invocation -> {
            Map<String, Object> params = invocation.getArgument(1);
            assertEquals("user1", params.get("userId"));

            List<String> chunk = (List<String>) params.get("itemIds");
            List<Map.Entry<String, Double>> rows = new ArrayList<>();
            for (int i = chunk.size() - 1; i >= 0; i--) {
                if (storedEnergies.containsKey(chunk.get(i))) {
                    rows.add(Map.entry(chunk.get(i), storedEnergies.get(chunk.get(i))));
                }
            }
            return rows;
        });

        Map<String, Double> energies = masteryDao.fetchEnergies("user1", List.of("a", "b", "c", "d", "e"));

        assertEquals(storedEnergies, energies);
        assertFalse(energies.containsKey("b"));
        verify(template, times(3)).query(anyString(), anyMap(), any(RowMapper.class));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testFetchEnergies_DuplicateIdsQueriedOnce() {
        when(template.query(anyString(), anyMap(), any(RowMapper.class))).thenReturn(List.of());

        masteryDao.fetchEnergies("user1", List.of("a", "a", "b", "b"));

        verify(template, times(1)).query(anyString(), anyMap(), any(RowMapper.class));
    }
}
