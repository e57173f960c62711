package com.copyleft.Treachery.domain.type;

public enum GameState {
    LOBBY,      // 대기 중 (입장 가능)
    COUNTDOWN,  // 역할 배정 후 시작 카운트다운 중 (입장 불가)
    PLAYING,    // 게임 진행 중
    ENDED;      // 게임 종료

    /**
     * 바로 다음 단계로만 이동할 수 있다. (LOBBY -> COUNTDOWN -> PLAYING -> ENDED)
     */
    public boolean canTransitionTo(GameState next) {
        return next != null && next.ordinal() == this.ordinal() + 1;
    }
}
