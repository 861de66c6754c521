package com.gt.lss.content;

import com.gt.lss.conf.CachingConfig;
import com.gt.lss.model.Goal;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class GoalService {

    private final ContentDao contentDao;

    @Autowired
    public GoalService(ContentDao contentDao) {
        this.contentDao = contentDao;
    }

    @Cacheable(CachingConfig.GOALS)
    public Optional<Goal> getGoal(String goalId) {
        return contentDao.loadGoal(goalId);
    }
}
