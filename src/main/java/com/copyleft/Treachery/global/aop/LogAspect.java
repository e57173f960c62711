package com.copyleft.Treachery.global.aop;

import com.copyleft.Treachery.domain.Player;
import com.copyleft.Treachery.domain.Room;
import com.copyleft.Treachery.global.exception.GameException;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Pointcut;
import org.springframework.stereotype.Component;
import org.springframework.util.StopWatch;

import java.util.Arrays;
import java.util.Collection;
import java.util.stream.Collectors;

@Slf4j
@Aspect
@Component
public class LogAspect {

    private static final long SLOW_CALL_MS = 500L;

    @Pointcut("execution(public * com.copyleft.Treachery.feature..*Service.*(..))")
    public void serviceLayer() {}

    @Around("serviceLayer()")
    public Object logExecutionTime(ProceedingJoinPoint joinPoint) throws Throwable {
        StopWatch stopWatch = new StopWatch();
        stopWatch.start();

        String className = joinPoint.getSignature().getDeclaringType().getSimpleName();
        String methodName = joinPoint.getSignature().getName();

        if (log.isDebugEnabled()) {
            String args = Arrays.stream(joinPoint.getArgs())
                    .map(LogAspect::describe)
                    .collect(Collectors.joining(", "));
            log.debug("▶ [START] {}.{} | Args: [{}]", className, methodName, args);
        }

        Object result = null;
        try {
            result = joinPoint.proceed();
            return result;
        } catch (GameException e) {
            // 사용자 입력으로 생기는 예상된 실패
            log.info("⚠ [REJECTED] {}.{} | {}: {}", className, methodName, e.getErrorCode(), e.getMessage());
            throw e;
        } catch (Throwable e) {
            log.warn("🛑 [EXCEPTION] {}.{} | Msg: {}", className, methodName, e.getMessage());
            throw e;
        } finally {
            if (stopWatch.isRunning()) {
                stopWatch.stop();
            }
            long elapsed = stopWatch.getTotalTimeMillis();
            if (elapsed >= SLOW_CALL_MS) {
                log.warn("🐢 [SLOW] {}.{} | Time: {}ms", className, methodName, elapsed);
            }
            log.debug("◀ [END] {}.{} | Result: {} | Time: {}ms", className, methodName, describe(result), elapsed);
        }
    }

    // 방과 플레이어 목록은 통째로 찍으면 너무 길어서 요약만 남긴다
    private static String describe(Object value) {
        if (value instanceof Room) {
            Room room = (Room) value;
            return "Room(" + room.getCode() + ", " + room.getState() + ")";
        }
        if (value instanceof Player) {
            Player player = (Player) value;
            return "Player(" + player.getName() + ")";
        }
        if (value instanceof Collection) {
            return "size=" + ((Collection<?>) value).size();
        }
        return String.valueOf(value);
    }
}
