package com.gt.lss.bandit.impl;

import com.gt.lss.model.BanditArmState;
import com.gt.lss.model.ProfileName;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.sql.ResultSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(SpringExtension.class)
public class BanditArmDaoPGTests {

    @Mock private NamedParameterJdbcTemplate template;
    @Mock private ResultSet resultSet;

    private BanditArmDaoPG banditArmDao;

    @BeforeEach
    public void setup() {
        banditArmDao = new BanditArmDaoPG(template);
    }

    @Test
    public void testFetchBanditArms() throws Exception {
        when(resultSet.getString("user_id")).thenReturn("user1");
        when(resultSet.getString("goal_group")).thenReturn("jlpt");
        when(resultSet.getString("profile_name")).thenReturn("UrgencyHeavy", "RetiredProfile", "Balanced");
        when(resultSet.getDouble("successes")).thenReturn(3.5, 1.0);
        when(resultSet.getDouble("failures")).thenReturn(1.5, 2.0);

        doAnswer(invocation -> {
            RowCallbackHandler handler = invocation.getArgument(2);
            for (int i = 0; i < 3; i++) {
                handler.processRow(resultSet);
            }
            return null;
        }).when(template).query(anyString(), anyMap(), any(RowCallbackHandler.class));

        List<BanditArmState> arms = banditArmDao.fetchBanditArms("user1", "jlpt");

        assertEquals(List.of(
                new BanditArmState("user1", "jlpt", ProfileName.UrgencyHeavy, 3.5, 1.5),
                new BanditArmState("user1", "jlpt", ProfileName.Balanced, 1.0, 2.0)), arms);
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testInsertBanditArmIfAbsent() {
        banditArmDao.insertBanditArmIfAbsent("user1", "jlpt", "InfluenceHeavy", 1.0, 1.0);

        ArgumentCaptor<String> sqlCaptor = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<Map<String, Object>> paramsCaptor = ArgumentCaptor.forClass(Map.class);
        verify(template, times(1)).update(sqlCaptor.capture(), paramsCaptor.capture());

        assertTrue(sqlCaptor.getValue().contains("ON CONFLICT DO NOTHING"));
        assertFalse(sqlCaptor.getValue().contains("DO UPDATE"));

        Map<String, Object> params = paramsCaptor.getValue();
        assertEquals("user1", params.get("userId"));
        assertEquals("jlpt", params.get("goalGroup"));
        assertEquals("InfluenceHeavy", params.get("profileName"));
        assertEquals(1.0, params.get("successes"));
        assertEquals(1.0, params.get("failures"));
        assertNotNull(params.get("updateInstant"));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testIncrementBanditArm() throws Exception {
        when(resultSet.getString("user_id")).thenReturn("user1");
        when(resultSet.getString("goal_group")).thenReturn("jlpt");
        when(resultSet.getString("profile_name")).thenReturn("InfluenceHeavy");
        when(resultSet.getDouble("successes")).thenReturn(4.75);
        when(resultSet.getDouble("failures")).thenReturn(3.25);

        when(template.queryForObject(anyString(), anyMap(), any(RowMapper.class))).thenAnswer(invocation -> {
            RowMapper<BanditArmState> rowMapper = invocation.getArgument(2);
            return rowMapper.mapRow(resultSet, 0);
        });

        BanditArmState updated = banditArmDao.incrementBanditArm("user1", "jlpt", "InfluenceHeavy", 0.75);

        assertEquals(new BanditArmState("user1", "jlpt", ProfileName.InfluenceHeavy, 4.75, 3.25), updated);

        ArgumentCaptor<String> sqlCaptor = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<Map<String, Object>> paramsCaptor = ArgumentCaptor.forClass(Map.class);
        verify(template, times(1)).queryForObject(sqlCaptor.capture(), paramsCaptor.capture(), any(RowMapper.class));
        verify(template, never()).update(anyString(), anyMap());

        String sql = sqlCaptor.getValue();
        assertTrue(sql.contains("successes = user_bandit_state.successes + :reward"));
        assertTrue(sql.contains("failures = user_bandit_state.failures + :penalty"));
        assertTrue(sql.contains("RETURNING"));

        Map<String, Object> params = paramsCaptor.getValue();
        assertEquals("user1", params.get("userId"));
        assertEquals("jlpt", params.get("goalGroup"));
        assertEquals("InfluenceHeavy", params.get("profileName"));
        assertEquals(0.75, params.get("reward"));
        assertEquals(0.25, params.get("penalty"));
        assertEquals(1.75, params.get("initialSuccesses"));
        assertEquals(1.25, params.get("initialFailures"));
        assertNotNull(params.get("updateInstant"));
    }
}
